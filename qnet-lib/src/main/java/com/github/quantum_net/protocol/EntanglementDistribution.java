// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.ResourceExhaustedException;
import com.github.quantum_net.resource.EntanglementPair;
import com.github.quantum_net.resource.NetworkQubit;
import com.github.quantum_net.topology.Node;

import java.util.ArrayList;
import java.util.List;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Establishes hosted entanglement across a list of nodes.
public final class EntanglementDistribution {
  /// Purifying `k` rounds starts from `2^k` pairs per segment.
  static final int MAX_PURIFICATION_ROUNDS = 30;

  private final ProtocolContext context;

  public EntanglementDistribution(ProtocolContext context) {
    this.context = context;
  }

  public ProtocolResult.EntangleResult run(ProtocolInvocation.Entangle invocation) {
    final var kind = EntanglementKind.fromString(invocation.kind());
    if (invocation.nodes().size() < 2) {
      throw new ConfigurationException("entanglement needs at least two nodes: " + invocation.nodes());
    }
    if (invocation.purificationRounds() < 0 || invocation.purificationRounds() > MAX_PURIFICATION_ROUNDS) {
      throw new ConfigurationException("purification rounds must be in [0," + MAX_PURIFICATION_ROUNDS + "]: "
          + invocation.purificationRounds());
    }
    final List<Node> nodes = invocation.nodes().stream().map(context::node).toList();
    if (nodes.stream().map(Node::id).distinct().count() != nodes.size()) {
      throw new ConfigurationException("entanglement nodes must be distinct: " + invocation.nodes());
    }
    return switch (kind) {
      case BELL -> bell(invocation, nodes);
      case GHZ -> ghz(invocation, nodes);
      case CLUSTER -> cluster(invocation, nodes);
    };
  }

  private ProtocolResult.EntangleResult bell(ProtocolInvocation.Entangle invocation, List<Node> nodes) {
    final var swapping = new EntanglementSwapping(context);
    final var purification = new PurificationProtocol(context);
    final var pairs = new ArrayList<EntanglementPair>();
    int purifications = 0;
    for (int i = 0; i + 1 < nodes.size(); i++) {
      final var route = context.route(nodes.get(i).id(), nodes.get(i + 1).id());
      final int copies = invocation.purify() ? 1 << invocation.purificationRounds() : 1;
      for (var end : List.of(nodes.get(i), nodes.get(i + 1))) {
        if (copies > end.capacity()) {
          throw new ResourceExhaustedException("node " + end.id() + " can host " + end.capacity()
              + " qubits but purifying " + invocation.purificationRounds() + " rounds needs " + copies);
        }
      }
      final var segment = new ArrayList<EntanglementPair>(copies);
      for (int c = 0; c < copies; c++) {
        final var created = swapping.chain(route, true);
        segment.add(created.get(created.size() - 1));
      }
      if (invocation.purify()) {
        final var purified = purification.purify(segment, invocation.fidelityThreshold(), invocation.purificationRounds());
        purifications += purified.roundsPerformed();
        purified.pairIds().stream().map(context.resources()::pair).forEach(pairs::add);
      } else {
        pairs.addAll(segment);
      }
    }
    final double fidelity = pairs.stream().mapToDouble(EntanglementPair::fidelity).min().orElse(0.0);
    final var qubitIds = new ArrayList<String>();
    pairs.forEach(p -> {
      qubitIds.add(p.qubitA());
      qubitIds.add(p.qubitB());
    });
    final int rounds = purifications;
    LOGGER.fine(() -> context.correlation() + " bell pairs " + pairs.size() + " fidelity=" + fidelity
        + " purifications=" + rounds);
    return new ProtocolResult.EntangleResult(Status.COMPLETED, EntanglementKind.BELL, invocation.nodes(),
        pairs.stream().map(EntanglementPair::id).toList(), qubitIds, fidelity,
        fidelity >= invocation.fidelityThreshold(), purifications);
  }

  private ProtocolResult.EntangleResult ghz(ProtocolInvocation.Entangle invocation, List<Node> nodes) {
    final var members = context.resources().createGhz(nodes);
    final double fidelity = context.resources().pairFidelity();
    LOGGER.fine(() -> context.correlation() + " ghz over " + invocation.nodes());
    return new ProtocolResult.EntangleResult(Status.COMPLETED, EntanglementKind.GHZ, invocation.nodes(), List.of(),
        members.stream().map(NetworkQubit::id).toList(), fidelity, fidelity >= invocation.fidelityThreshold(), 0);
  }

  private ProtocolResult.EntangleResult cluster(ProtocolInvocation.Entangle invocation, List<Node> nodes) {
    final var builder = context.config().clusterStateBuilder();
    if (builder == null) {
      throw new ConfigurationException("cluster states need a ClusterStateBuilder in the engine config");
    }
    final var members = builder.build(nodes, context.resources(), context.rng());
    final double fidelity = members.stream().mapToDouble(NetworkQubit::fidelity).min().orElse(0.0);
    return new ProtocolResult.EntangleResult(Status.COMPLETED, EntanglementKind.CLUSTER, invocation.nodes(), List.of(),
        members.stream().map(NetworkQubit::id).toList(), fidelity, fidelity >= invocation.fidelityThreshold(), 0);
  }
}
