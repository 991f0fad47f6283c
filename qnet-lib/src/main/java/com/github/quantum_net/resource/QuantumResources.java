// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import com.github.quantum_net.QubitStateException;
import com.github.quantum_net.ResourceExhaustedException;
import com.github.quantum_net.UnknownReferenceException;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.random.RandomGenerator;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// The quantum resource model of one engine: every qubit and entangled pair of the network lives in the two arenas
/// held here. All randomness is passed in by the caller so that a protocol run with a seeded generator is
/// reproducible.
public final class QuantumResources {
  private final Arena<NetworkQubit> qubits = new Arena<>("qubit");
  private final Arena<EntanglementPair> pairs = new Arena<>("entangled pair");
  private final Clock clock;
  private final double pairFidelity;
  private final AtomicLong sequence = new AtomicLong();

  /// @param pairFidelity the fidelity given to freshly generated Bell pairs
  public QuantumResources(Clock clock, double pairFidelity) {
    this.clock = clock;
    this.pairFidelity = pairFidelity;
  }

  /// Creates the register of a node: `count` qubits in |0> named `<hostId>_q<i>`.
  public List<NetworkQubit> initialize(QubitHost host, int count) {
    final var created = new ArrayList<NetworkQubit>(count);
    for (int i = 0; i < count; i++) {
      final var qubit = host(host, host.hostId() + "_q" + i);
      qubit.markIdle();
      created.add(qubit);
    }
    return created;
  }

  /// Creates a hosted qubit for a protocol. When the host is at capacity an idle register qubit is retired to free
  /// its slot.
  ///
  /// @throws ResourceExhaustedException if the host is full and has no idle register qubit
  public NetworkQubit claim(QubitHost host, String qubitId) {
    synchronized (host) {
      if (host.liveQubits() >= host.capacity()) {
        host.idleQubit().ifPresent(idle -> {
          idle.markConsumed();
          LOGGER.finest(() -> "retired idle " + idle.id() + " to make room for " + qubitId);
        });
      }
      return host(host, qubitId);
    }
  }

  /// Creates a qubit in |0> owned by the host.
  ///
  /// @throws QubitStateException if the id was ever used before, consumed qubits keep their ids
  public NetworkQubit host(QubitHost host, String qubitId) {
    if (qubits.find(qubitId).isPresent()) {
      throw new QubitStateException("qubit id already in use: " + qubitId);
    }
    final var qubit = qubits.allocate(qubitId, h -> new NetworkQubit(qubitId, h, host.hostId(), clock.instant()));
    try {
      host.host(qubit);
    } catch (RuntimeException e) {
      qubits.release(qubit.handle());
      throw e;
    }
    return qubit;
  }

  /// A qubit located at the node for the duration of a protocol run but not registered with it. Photons in flight
  /// are modelled this way. Release it with [#release(NetworkQubit)] when the run ends.
  public NetworkQubit allocateTransient(String nodeId, String idPrefix) {
    final var id = idPrefix + "#" + sequence.incrementAndGet();
    return qubits.allocate(id, h -> new NetworkQubit(id, h, nodeId, clock.instant()));
  }

  public String nextId(String prefix) {
    return prefix + sequence.incrementAndGet();
  }

  /// Z encodes 0 as |0> and 1 as |1>; X encodes 0 as |+> and 1 as |->.
  public void applyBasisPreparation(NetworkQubit qubit, int bit, Basis basis) {
    qubit.checkLive();
    if (qubit.sharedState().isPresent()) {
      throw new QubitStateException("cannot prepare entangled qubit " + qubit.id());
    }
    qubit.amplitudes(Amplitudes.basisState(basis, bit));
  }

  /// Projective measurement. The qubit is consumed whatever the outcome.
  ///
  /// @return 0 or 1
  public int measure(NetworkQubit qubit, Basis basis, RandomGenerator rng) {
    qubit.checkLive();
    final int outcome;
    final var shared = qubit.sharedState();
    if (shared.isPresent()) {
      outcome = shared.get().measure(qubit, basis, rng);
    } else {
      final double zero = qubit.amplitudes().probabilityOfZero(basis);
      outcome = rng.nextDouble() < zero ? 0 : 1;
      qubit.amplitudes(Amplitudes.basisState(basis, outcome));
    }
    qubit.markConsumed();
    LOGGER.finest(() -> "measured " + qubit.id() + " in " + basis + " -> " + outcome);
    return outcome;
  }

  public void applyPauli(NetworkQubit qubit, Pauli pauli) {
    qubit.checkLive();
    if (pauli == Pauli.I) {
      return;
    }
    final var shared = qubit.sharedState();
    if (shared.isPresent()) {
      shared.get().applyPauli(qubit, pauli);
    } else {
      qubit.amplitudes(pauli.apply(qubit.amplitudes()));
    }
  }

  /// The teleportation correction: X if `bits[0]` is 1 then Z if `bits[1]` is 1.
  public void applyPauliCorrection(NetworkQubit qubit, int[] bits) {
    if (bits.length != 2) {
      throw new IllegalArgumentException("a correction needs two classical bits: " + bits.length);
    }
    if (bits[0] == 1) applyPauli(qubit, Pauli.X);
    if (bits[1] == 1) applyPauli(qubit, Pauli.Z);
  }

  /// Removes the qubit from play without a read out. Any entangled partners are left as if it had been measured and
  /// the result forgotten.
  public void consume(NetworkQubit qubit, RandomGenerator rng) {
    qubit.checkLive();
    final var shared = qubit.sharedState();
    if (shared.isPresent()) {
      shared.get().measure(qubit, Basis.Z, rng);
    }
    qubit.markConsumed();
  }

  /// Frees the arena slot of a transient qubit. Hosted qubits stay as tombstones and cannot be released.
  public void release(NetworkQubit qubit) {
    if (qubit.sharedState().isPresent()) {
      qubit.sharedState().get().dissolve();
    }
    qubit.markConsumed();
    qubits.release(qubit.handle());
  }

  /// Frees a transient pair and both its halves.
  public void release(EntanglementPair pair) {
    if (pair.hosted()) {
      throw new QubitStateException("hosted pair " + pair.id() + " cannot be released");
    }
    findQubit(pair.handleA()).ifPresent(this::release);
    findQubit(pair.handleB()).ifPresent(this::release);
    pairs.release(pair.handle());
  }

  /// A |Φ+> pair with one hosted half at each host.
  public EntanglementPair createEntangledPair(QubitHost a, QubitHost b) {
    final var qa = claim(a, nextId(a.hostId() + "_e"));
    final NetworkQubit qb;
    try {
      qb = claim(b, nextId(b.hostId() + "_e"));
    } catch (RuntimeException e) {
      qa.markConsumed();
      throw e;
    }
    return register(qa, qb, EntangledState.BellFrame.PHI_PLUS, pairFidelity, true);
  }

  /// A |Φ+> pair of transient qubits located at the two nodes.
  public EntanglementPair createTransientPair(String nodeA, String nodeB) {
    final var qa = allocateTransient(nodeA, nodeA + "_epr");
    final var qb = allocateTransient(nodeB, nodeB + "_epr");
    return register(qa, qb, EntangledState.BellFrame.PHI_PLUS, pairFidelity, false);
  }

  private EntanglementPair register(NetworkQubit qa, NetworkQubit qb, EntangledState.BellFrame frame,
                                    double fidelity, boolean hosted) {
    EntangledState.bell(qa, qb, frame);
    qa.fidelity(fidelity);
    qb.fidelity(fidelity);
    final var id = nextId("pair-");
    return pairs.allocate(id, h -> new EntanglementPair(id, h,
        qa.id(), qa.handle(), qa.nodeId(),
        qb.id(), qb.handle(), qb.nodeId(),
        fidelity, clock.instant(), hosted));
  }

  /// One hosted qubit per host, all sharing `(|0..0> + |1..1>)/sqrt(2)`. A single host gets a lone qubit in |+>.
  public List<NetworkQubit> createGhz(List<? extends QubitHost> hosts) {
    final var members = new ArrayList<NetworkQubit>(hosts.size());
    try {
      for (var host : hosts) {
        members.add(claim(host, nextId(host.hostId() + "_g")));
      }
    } catch (RuntimeException e) {
      members.forEach(NetworkQubit::markConsumed);
      throw e;
    }
    members.forEach(q -> q.fidelity(pairFidelity));
    if (members.size() == 1) {
      members.get(0).amplitudes(Amplitudes.PLUS);
    } else if (members.size() > 1) {
      EntangledState.ghz(members);
    }
    return members;
  }

  /// The first half of teleportation: a Bell measurement of the source qubit with the local half of the pair. The
  /// remote half is left holding `X^x Z^z` applied to the source state, together with any Pauli frame the pair had
  /// picked up from noise. Both measured qubits are consumed.
  public BellMeasurement bellMeasure(NetworkQubit source, EntanglementPair pair, String localNodeId,
                                     RandomGenerator rng) {
    source.checkLive();
    final var pairState = requireLive(pair);
    final var local = qubit(pair.qubitAt(localNodeId));
    final var remote = qubit(pair.partnerOf(local.id()));
    final var frame = pairState.frame();
    final int xBit = rng.nextBoolean() ? 1 : 0;
    final int zBit = rng.nextBoolean() ? 1 : 0;
    pairState.dissolve();
    local.markConsumed();

    final int residualX = xBit ^ frame.parity();
    final int residualZ = zBit ^ frame.zBit();
    final var sourceShared = source.sharedState();
    if (sourceShared.isPresent()) {
      final var state = sourceShared.get();
      state.replace(source, remote);
      if (residualZ == 1) state.applyPauli(remote, Pauli.Z);
      if (residualX == 1) state.applyPauli(remote, Pauli.X);
    } else {
      var carried = source.amplitudes();
      if (residualZ == 1) carried = Pauli.Z.apply(carried);
      if (residualX == 1) carried = Pauli.X.apply(carried);
      remote.amplitudes(carried);
    }
    source.markConsumed();
    return new BellMeasurement(remote, new int[]{xBit, zBit});
  }

  /// Moves the state held by a qubit into a new qubit hosted at the target, consuming the carrier.
  public NetworkQubit takeOver(NetworkQubit carrier, QubitHost target, String newQubitId) {
    carrier.checkLive();
    final var carried = carrier.amplitudes();
    final var shared = carrier.sharedState();
    // a hosted carrier frees its slot before the new qubit is claimed
    carrier.markConsumed();
    final var received = claim(target, newQubitId);
    if (shared.isPresent()) {
      shared.get().replace(carrier, received);
    } else {
      received.amplitudes(carried);
    }
    return received;
  }

  /// Entanglement swapping at the node holding `middleA` and `middleB`. The two middle qubits are consumed and the
  /// outer halves end up entangled with fidelity `f1*f2`.
  ///
  /// @param correct when true the Bell measurement bits are applied as a correction at the far end of the second
  ///                pair; when false the outer qubits are left in an uncorrected Bell state
  public SwapOutcome swap(EntanglementPair first, NetworkQubit middleA,
                          EntanglementPair second, NetworkQubit middleB,
                          boolean correct, RandomGenerator rng) {
    final var stateA = requireLive(first);
    final var stateB = requireLive(second);
    if (!middleA.nodeId().equals(middleB.nodeId())) {
      throw new QubitStateException("swap qubits " + middleA.id() + " and " + middleB.id() + " are at different nodes");
    }
    final var outerA = qubit(first.partnerOf(middleA.id()));
    final var outerB = qubit(second.partnerOf(middleB.id()));
    if (outerA.nodeId().equals(middleA.nodeId()) || outerB.nodeId().equals(middleB.nodeId())) {
      throw new QubitStateException("swap needs pairs reaching other nodes from " + middleA.nodeId());
    }
    if (outerA.nodeId().equals(outerB.nodeId())) {
      throw new QubitStateException("swap of " + first.id() + " and " + second.id() + " would join "
          + outerA.nodeId() + " to itself");
    }
    final int xBit = rng.nextBoolean() ? 1 : 0;
    final int zBit = rng.nextBoolean() ? 1 : 0;
    final var measured = EntangledState.BellFrame.of(xBit, zBit);
    var frame = stateA.frame().compose(stateB.frame());
    if (!correct) {
      frame = frame.compose(measured);
    }
    stateA.dissolve();
    stateB.dissolve();
    middleA.markConsumed();
    middleB.markConsumed();
    final double fidelity = first.fidelity() * second.fidelity();
    final var pair = register(outerA, outerB, frame, fidelity, first.hosted() && second.hosted());
    return new SwapOutcome(pair, correct ? new int[]{xBit, zBit} : null);
  }

  /// Consumes both halves of a pair, e.g. the sacrificed pair of a purification round.
  public void consume(EntanglementPair pair, RandomGenerator rng) {
    final var a = qubit(pair.handleA());
    final var b = qubit(pair.handleB());
    if (!a.isConsumed()) consume(a, rng);
    if (!b.isConsumed()) consume(b, rng);
  }

  public EntanglementPair withFidelity(EntanglementPair pair, double fidelity) {
    final var updated = pair.withFidelity(fidelity);
    pairs.replace(pair.handle(), updated);
    qubit(pair.handleA()).fidelity(fidelity);
    qubit(pair.handleB()).fidelity(fidelity);
    return updated;
  }

  /// @return whether both halves are live and still share their Bell state.
  public boolean isLive(EntanglementPair pair) {
    final var a = findQubit(pair.handleA());
    final var b = findQubit(pair.handleB());
    if (a.isEmpty() || b.isEmpty() || a.get().isConsumed() || b.get().isConsumed()) {
      return false;
    }
    final var state = a.get().sharedState();
    return state.isPresent() && state.get().size() == 2 && state.get().contains(b.get());
  }

  private EntangledState requireLive(EntanglementPair pair) {
    if (!isLive(pair)) {
      throw new QubitStateException("entangled pair " + pair.id() + " has been consumed");
    }
    return qubit(pair.handleA()).sharedState().orElseThrow();
  }

  public NetworkQubit qubit(String id) {
    return qubits.byId(id);
  }

  public Optional<NetworkQubit> find(String id) {
    return qubits.find(id).flatMap(qubits::find);
  }

  public NetworkQubit qubit(Handle handle) {
    return qubits.get(handle);
  }

  private Optional<NetworkQubit> findQubit(Handle handle) {
    return qubits.find(handle);
  }

  /// @throws UnknownReferenceException if no pair has the id
  public EntanglementPair pair(String id) {
    return pairs.byId(id);
  }

  public List<EntanglementPair> pairs() {
    return pairs.values();
  }

  public int qubitCount() {
    return qubits.size();
  }

  public double pairFidelity() {
    return pairFidelity;
  }

  /// The outcome of a Bell measurement: the remote qubit now carrying the state and the two classical bits.
  public record BellMeasurement(NetworkQubit carrier, int[] bits) {
  }

  /// @param correctionBits null when the swap was left uncorrected
  public record SwapOutcome(EntanglementPair pair, @Nullable int[] correctionBits) {
  }
}
