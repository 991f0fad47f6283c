// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.resource.NetworkQubit;
import com.github.quantum_net.resource.QuantumResources;
import com.github.quantum_net.topology.Node;

import java.util.List;
import java.util.random.RandomGenerator;

/// Builds a cluster (graph) state over the listed nodes. The engine ships no implementation because cluster states
/// need controlled phase gates which the resource model does not simulate. Supply one through
/// `EngineConfig.withClusterStateBuilder`.
@FunctionalInterface
public interface ClusterStateBuilder {

  /// @return the qubits of the cluster, one or more per node, hosted at their nodes
  List<NetworkQubit> build(List<Node> nodes, QuantumResources resources, RandomGenerator rng);
}
