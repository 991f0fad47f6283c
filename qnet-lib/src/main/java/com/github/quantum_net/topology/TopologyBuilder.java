// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.topology;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.EngineConfig;
import com.github.quantum_net.network.Channel;
import com.github.quantum_net.resource.QuantumResources;

import java.util.ArrayList;
import java.util.List;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Turns a [NetworkSpec] into a [Network]:
///
/// 1. nodes in declaration order, each with its register initialised to |0>
/// 2. the declared links with their channels
/// 3. a link with default distance and loss for every pair the topology prescribes that is not linked yet
public final class TopologyBuilder {
  private final QuantumResources resources;
  private final EngineConfig config;

  public TopologyBuilder(QuantumResources resources, EngineConfig config) {
    this.resources = resources;
    this.config = config;
  }

  /// @throws ConfigurationException if the description is inconsistent
  public Network build(NetworkSpec spec) {
    final var kind = TopologyKind.fromString(spec.topology());
    final var network = new Network(spec.name(), kind);

    for (var nodeSpec : spec.nodes()) {
      final var nodeKind = NodeKind.fromString(nodeSpec.kind());
      if (network.hasNode(nodeSpec.id())) {
        throw new ConfigurationException("duplicate node id: " + nodeSpec.id());
      }
      if (nodeSpec.qubitCount() < 0) {
        throw new ConfigurationException("node " + nodeSpec.id() + " has negative qubit count " + nodeSpec.qubitCount());
      }
      final var node = new Node(nodeSpec.id(), nodeKind, nodeSpec.position(), nodeSpec.qubitCount(), nodeSpec.memory());
      network.add(node);
      resources.initialize(node, nodeSpec.qubitCount());
    }

    for (var linkSpec : spec.links()) {
      addLink(network, linkSpec);
    }

    final List<String> ids = network.nodeIds();
    int added = 0;
    for (int[] pair : kind.pairs(ids.size())) {
      final var a = ids.get(pair[0]);
      final var b = ids.get(pair[1]);
      if (!a.equals(b) && network.linkBetween(a, b).isEmpty()) {
        addLink(network, NetworkSpec.LinkSpec.of(a, b, config.defaultLinkDistance(), config.defaultLossRate()));
        added++;
      }
    }
    final int topologyLinks = added;
    LOGGER.fine(() -> "built " + kind + " network " + spec.name() + " nodes=" + ids.size()
        + " links=" + network.links().size() + " topologyLinks=" + topologyLinks);
    return network;
  }

  private void addLink(Network network, NetworkSpec.LinkSpec spec) {
    if (!network.hasNode(spec.source()) || !network.hasNode(spec.target())) {
      throw new ConfigurationException("link " + spec.source() + "-" + spec.target() + " names an undeclared node");
    }
    if (spec.source().equals(spec.target())) {
      throw new ConfigurationException("self link at " + spec.source());
    }
    if (network.linkBetween(spec.source(), spec.target()).isPresent()) {
      throw new ConfigurationException("duplicate link between " + spec.source() + " and " + spec.target());
    }
    if (!(spec.lossRate() >= 0.0 && spec.lossRate() <= 1.0)) {
      throw new ConfigurationException("loss rate must be in [0,1]: " + spec.lossRate());
    }
    if (!(spec.distance() >= 0.0)) {
      throw new ConfigurationException("distance must not be negative: " + spec.distance());
    }
    final var linkId = spec.source() + "-" + spec.target();
    final var channelSpecs = spec.channels().isEmpty()
        ? List.of(new NetworkSpec.ChannelSpec(linkId + "/classical", config.defaultChannelCapacity(),
        config.defaultChannelFidelity(), config.defaultBandwidth()))
        : spec.channels();
    final var channels = new ArrayList<Channel>(channelSpecs.size());
    for (var cs : channelSpecs) {
      if (network.hasChannel(cs.id()) || channels.stream().anyMatch(c -> c.id().equals(cs.id()))) {
        throw new ConfigurationException("duplicate channel id: " + cs.id());
      }
      if (cs.capacity() < 1) {
        throw new ConfigurationException("channel " + cs.id() + " capacity must be at least 1: " + cs.capacity());
      }
      if (!(cs.fidelity() >= 0.0 && cs.fidelity() <= 1.0)) {
        throw new ConfigurationException("channel " + cs.id() + " fidelity must be in [0,1]: " + cs.fidelity());
      }
      if (!(cs.bandwidth() > 0.0)) {
        throw new ConfigurationException("channel " + cs.id() + " bandwidth must be positive: " + cs.bandwidth());
      }
      channels.add(new Channel(cs.id(), linkId, cs.capacity(), cs.fidelity(), cs.bandwidth()));
    }
    network.add(new Link(linkId, spec.source(), spec.target(), spec.distance(), spec.lossRate(), channels));
  }
}
