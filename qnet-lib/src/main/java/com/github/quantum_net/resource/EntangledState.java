// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import com.github.quantum_net.QubitStateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;

/// A joint state of the GHZ class shared by two or more qubits:
///
/// `(|b> + s|~b>)/sqrt(2)`
///
/// where `b` is a bit per member and `s` is +1 or -1. A Bell pair |Φ+> is two members with `b = 00` and `s = +1`.
/// An N qubit GHZ state is N members with all bits zero and a positive sign.
///
/// This is not a literal 2^N amplitude vector yet it is exact for everything the engine does to entangled qubits:
///
/// - Pauli X flips the member's bit, Pauli Z flips the sign and Y does both (up to a global phase).
/// - A Z measurement of any member yields a uniform bit and collapses every member to a product basis state.
/// - An X measurement of any member yields a uniform bit `o`, removes the member and multiplies the sign by `(-1)^o`.
///   When only one member remains it is left in |+> or |-> according to the sign.
///
/// So all N party correlations of Z and X measurements are reproduced: Z outcomes of an untouched GHZ state all
/// agree and the parity of an all X read out is even when the sign is positive.
public final class EntangledState {
  private final List<NetworkQubit> members = new ArrayList<>();
  private final List<Boolean> bits = new ArrayList<>();
  private int sign;

  private EntangledState(List<NetworkQubit> qubits, List<Boolean> bits, int sign) {
    this.members.addAll(qubits);
    this.bits.addAll(bits);
    this.sign = sign;
  }

  /// Ties the qubits into `(|0..0> + |1..1>)/sqrt(2)`.
  static EntangledState ghz(List<NetworkQubit> qubits) {
    if (qubits.size() < 2) {
      throw new IllegalArgumentException("an entangled state needs at least two members: " + qubits.size());
    }
    final var state = new EntangledState(qubits, qubits.stream().map(q -> Boolean.FALSE).toList(), 1);
    state.introduceMembers();
    return state;
  }

  /// Ties two qubits into the Bell state with the given frame e.g. parity 0 and sign +1 is |Φ+>.
  static EntangledState bell(NetworkQubit first, NetworkQubit second, BellFrame frame) {
    final var state = new EntangledState(List.of(first, second), List.of(false, frame.parity() == 1), frame.sign());
    state.introduceMembers();
    return state;
  }

  private void introduceMembers() {
    for (var member : members) {
      final Set<String> partners = members.stream()
          .filter(m -> m != member)
          .map(NetworkQubit::id)
          .collect(Collectors.toCollection(java.util.LinkedHashSet::new));
      member.join(this, partners);
    }
  }

  public synchronized int size() {
    return members.size();
  }

  public synchronized List<String> memberIds() {
    return members.stream().map(NetworkQubit::id).toList();
  }

  public synchronized boolean contains(NetworkQubit qubit) {
    return members.contains(qubit);
  }

  /// The Bell frame of a two member state.
  public synchronized BellFrame frame() {
    if (members.size() != 2) {
      throw new QubitStateException("a Bell frame needs exactly two members but there are " + members.size());
    }
    return new BellFrame(bits.get(0) ^ bits.get(1) ? 1 : 0, sign);
  }

  synchronized void applyPauli(NetworkQubit qubit, Pauli pauli) {
    final int k = indexOf(qubit);
    if (pauli.flipsBit()) {
      bits.set(k, !bits.get(k));
    }
    if (pauli.flipsPhase()) {
      sign = -sign;
    }
  }

  /// Measures one member, collapsing or shrinking the state as described in the class comment.
  ///
  /// @return the classical outcome 0 or 1.
  synchronized int measure(NetworkQubit qubit, Basis basis, RandomGenerator rng) {
    final int k = indexOf(qubit);
    final int outcome = rng.nextBoolean() ? 1 : 0;
    switch (basis) {
      case Z -> {
        // the branch whose bit for this member equals the outcome survives
        final boolean flip = bits.get(k) != (outcome == 1);
        for (int j = 0; j < members.size(); j++) {
          final boolean bit = bits.get(j) ^ flip;
          members.get(j).leave(Amplitudes.basisState(Basis.Z, bit ? 1 : 0));
        }
        members.clear();
        bits.clear();
      }
      case X -> {
        members.remove(k);
        bits.remove(k);
        qubit.leave(Amplitudes.basisState(Basis.X, outcome));
        if (outcome == 1) {
          sign = -sign;
        }
        members.forEach(m -> m.forgetPartner(qubit.id()));
        if (members.size() == 1) {
          members.get(0).leave(sign > 0 ? Amplitudes.PLUS : Amplitudes.MINUS);
          members.clear();
          bits.clear();
        }
      }
    }
    return outcome;
  }

  /// Puts a new qubit in the place of an existing member keeping its bit. Used when a member's state is teleported.
  synchronized void replace(NetworkQubit existing, NetworkQubit replacement) {
    final int k = indexOf(existing);
    members.set(k, replacement);
    final var partners = new java.util.LinkedHashSet<String>();
    for (var member : members) {
      if (member != replacement) {
        member.forgetPartner(existing.id());
        member.rememberPartner(replacement.id());
        partners.add(member.id());
      }
    }
    replacement.join(this, partners);
    existing.leave(Amplitudes.ZERO);
  }

  /// Releases every member without a read out. Only used when all members are consumed together.
  synchronized void dissolve() {
    members.forEach(m -> m.leave(Amplitudes.ZERO));
    members.clear();
    bits.clear();
  }

  private int indexOf(NetworkQubit qubit) {
    final int k = members.indexOf(qubit);
    if (k < 0) {
      throw new QubitStateException("qubit " + qubit.id() + " is no longer part of this entangled state");
    }
    return k;
  }

  /// The Pauli frame of a Bell pair relative to |Φ+>: parity 1 means an X error on one side and sign -1 a Z error.
  public record BellFrame(int parity, int sign) {
    public static final BellFrame PHI_PLUS = new BellFrame(0, 1);

    public BellFrame {
      if (parity != 0 && parity != 1) throw new IllegalArgumentException("parity must be 0 or 1: " + parity);
      if (sign != 1 && sign != -1) throw new IllegalArgumentException("sign must be +1 or -1: " + sign);
    }

    /// Combines two frames as entanglement swapping does.
    public BellFrame compose(BellFrame other) {
      return new BellFrame(parity ^ other.parity, sign * other.sign);
    }

    /// The frame introduced by an X^x Z^z operator on one side.
    public static BellFrame of(int xBit, int zBit) {
      return new BellFrame(xBit, zBit == 1 ? -1 : 1);
    }

    public int zBit() {
      return sign < 0 ? 1 : 0;
    }
  }
}
