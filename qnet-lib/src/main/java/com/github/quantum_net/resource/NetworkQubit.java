// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import com.github.quantum_net.QubitStateException;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/// A qubit owned by exactly one node. Ownership never moves: teleportation creates a new qubit at the target and
/// consumes this one.
///
/// While the qubit is a member of an [EntangledState] its own amplitude vector is nominal and measurements and Pauli
/// operations are routed through the shared state. Once the shared state collapses the qubit is given the product
/// state amplitudes that the collapse implies.
///
/// Instances are guarded by their own monitor. A protocol run only ever touches qubits it allocated or claimed so the
/// monitor is uncontended in practice.
public final class NetworkQubit {
  private final String id;
  private final Handle handle;
  private final String nodeId;
  private final Instant createdAt;
  private final Set<String> entangledWith = new LinkedHashSet<>();
  private Amplitudes amplitudes = Amplitudes.ZERO;
  private double fidelity = 1.0;
  private boolean consumed = false;
  private boolean idle = false;
  private @Nullable EntangledState sharedState = null;

  NetworkQubit(String id, Handle handle, String nodeId, Instant createdAt) {
    this.id = id;
    this.handle = handle;
    this.nodeId = nodeId;
    this.createdAt = createdAt;
  }

  public String id() {
    return id;
  }

  public Handle handle() {
    return handle;
  }

  public String nodeId() {
    return nodeId;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public synchronized Amplitudes amplitudes() {
    return amplitudes;
  }

  public synchronized double fidelity() {
    return fidelity;
  }

  public synchronized void fidelity(double fidelity) {
    if (fidelity < 0.0 || fidelity > 1.0) {
      throw new IllegalArgumentException("fidelity must be in [0,1]: " + fidelity);
    }
    this.fidelity = fidelity;
  }

  public synchronized boolean isConsumed() {
    return consumed;
  }

  /// @return true for a register qubit still in its initial |0> that no operation has touched
  public synchronized boolean isIdle() {
    return idle && !consumed;
  }

  public synchronized Set<String> entangledWith() {
    return Set.copyOf(entangledWith);
  }

  public synchronized Optional<EntangledState> sharedState() {
    return Optional.ofNullable(sharedState);
  }

  /// @throws QubitStateException if the qubit has been measured or consumed.
  public synchronized void checkLive() {
    if (consumed) {
      throw new QubitStateException("qubit " + id + " at " + nodeId + " has already been consumed");
    }
  }

  synchronized void amplitudes(Amplitudes amplitudes) {
    this.amplitudes = amplitudes;
    idle = false;
  }

  synchronized void markIdle() {
    idle = true;
  }

  synchronized void markConsumed() {
    consumed = true;
    idle = false;
  }

  synchronized void join(EntangledState state, Set<String> partners) {
    idle = false;
    sharedState = state;
    entangledWith.clear();
    entangledWith.addAll(partners);
  }

  /// Leaves the shared state with the product state that the collapse left this qubit in.
  synchronized void leave(Amplitudes collapsed) {
    sharedState = null;
    entangledWith.clear();
    amplitudes = collapsed;
  }

  synchronized void forgetPartner(String partnerId) {
    entangledWith.remove(partnerId);
  }

  synchronized void rememberPartner(String partnerId) {
    entangledWith.add(partnerId);
  }

  @Override
  public String toString() {
    return "NetworkQubit[" + id + "@" + nodeId + (consumed ? ",consumed" : "") + "]";
  }
}
