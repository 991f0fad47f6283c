// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.EngineConfig;
import com.github.quantum_net.network.ChannelTransport;
import com.github.quantum_net.resource.QuantumResources;
import com.github.quantum_net.routing.Route;
import com.github.quantum_net.routing.Router;
import com.github.quantum_net.topology.Network;
import com.github.quantum_net.topology.Node;

import java.util.random.RandomGenerator;

/// Everything a single protocol run works with. The generator and the correlation id belong to this run alone.
///
/// @param correlation tags the run's classical messages so concurrent runs on shared channels never mix
public record ProtocolContext(Network network,
                              QuantumResources resources,
                              ChannelTransport transport,
                              Router router,
                              EngineConfig config,
                              RandomGenerator rng,
                              String correlation) {

  public Node node(String id) {
    return network.node(id);
  }

  /// @throws ConfigurationException if both ends are the same node
  public Route route(String from, String to) {
    if (from.equals(to)) {
      throw new ConfigurationException("source and destination are both " + from);
    }
    return router.route(from, to);
  }

  public ClassicalRelay relay() {
    return new ClassicalRelay(transport, correlation, config.classicalTimeout());
  }
}
