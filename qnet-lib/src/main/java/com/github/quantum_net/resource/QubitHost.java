// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import com.github.quantum_net.ResourceExhaustedException;

import java.util.Optional;

/// Something that owns qubits. Nodes implement this so that the resource model can register the qubits it creates
/// without knowing about topology.
public interface QubitHost {
  String hostId();

  /// Registers a newly created qubit.
  ///
  /// @throws ResourceExhaustedException if the host has no free register or memory slot
  void host(NetworkQubit qubit);

  /// @return whether the host owns a qubit with this id
  boolean hosts(String qubitId);

  /// @return how many of the hosted qubits have not been consumed
  int liveQubits();

  /// @return the maximum number of live qubits
  int capacity();

  /// @return the highest numbered register qubit that is still idle, so low numbered ones stay available to callers
  Optional<NetworkQubit> idleQubit();
}
