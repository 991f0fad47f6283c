// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.topology;

import com.github.quantum_net.ResourceExhaustedException;
import com.github.quantum_net.resource.NetworkQubit;
import com.github.quantum_net.resource.QuantumMemory;
import com.github.quantum_net.resource.QubitHost;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A network node. It can host as many live qubits as its register holds plus its memory capacity. Qubits beyond the
/// register are counted as stored in memory.
public final class Node implements QubitHost {
  private final String id;
  private final NodeKind kind;
  private final @Nullable Position position;
  private final int registerSize;
  private final @Nullable QuantumMemory memory;
  private final Map<String, NetworkQubit> qubits = new LinkedHashMap<>();
  private final Set<String> neighbours = new LinkedHashSet<>();

  Node(String id, NodeKind kind, @Nullable Position position, int registerSize, @Nullable QuantumMemory memory) {
    this.id = id;
    this.kind = kind;
    this.position = position;
    this.registerSize = registerSize;
    this.memory = memory;
  }

  public String id() {
    return id;
  }

  @Override
  public String hostId() {
    return id;
  }

  public NodeKind kind() {
    return kind;
  }

  public Optional<Position> position() {
    return Optional.ofNullable(position);
  }

  public int registerSize() {
    return registerSize;
  }

  public Optional<QuantumMemory> memory() {
    return Optional.ofNullable(memory);
  }

  @Override
  public int capacity() {
    return registerSize + (memory == null ? 0 : memory.capacity());
  }

  @Override
  public synchronized void host(NetworkQubit qubit) {
    final int live = liveQubits();
    if (live >= capacity()) {
      throw new ResourceExhaustedException("node " + id + " cannot host " + qubit.id()
          + ": " + live + " live qubits at capacity " + capacity());
    }
    qubits.put(qubit.id(), qubit);
  }

  @Override
  public synchronized boolean hosts(String qubitId) {
    return qubits.containsKey(qubitId);
  }

  @Override
  public synchronized int liveQubits() {
    return (int) qubits.values().stream().filter(q -> !q.isConsumed()).count();
  }

  @Override
  public synchronized Optional<NetworkQubit> idleQubit() {
    return qubits.values().stream().filter(NetworkQubit::isIdle).reduce((first, second) -> second);
  }

  /// @return how many live qubits overflow the register into memory
  public synchronized int memoryOccupancy() {
    return Math.max(0, liveQubits() - registerSize);
  }

  /// @return a snapshot of every qubit ever hosted here, consumed ones included, in creation order
  public synchronized List<NetworkQubit> qubits() {
    return List.copyOf(qubits.values());
  }

  public synchronized Set<String> neighbours() {
    return Set.copyOf(neighbours);
  }

  /// Neighbours in the order their links were created.
  public synchronized List<String> neighbourList() {
    return List.copyOf(neighbours);
  }

  synchronized void addNeighbour(String nodeId) {
    neighbours.add(nodeId);
  }

  @Override
  public String toString() {
    return "Node[" + id + "," + kind + "]";
  }
}
