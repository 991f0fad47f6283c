// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.QubitStateException;
import com.github.quantum_net.resource.Basis;
import com.github.quantum_net.resource.EntanglementPair;

import java.util.ArrayList;
import java.util.List;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Recurrence purification. Each round pairs up the surviving pairs, sacrifices the second of each couple and raises
/// the fidelity of the first by a fixed step up to a cap. An odd leftover is sacrificed too so the count after k rounds
/// is `floor(initial / 2^k)`. The sacrificed halves are measured and one side's outcomes are sent to the other over
/// the classical channels.
public final class PurificationProtocol {
  private final ProtocolContext context;

  public PurificationProtocol(ProtocolContext context) {
    this.context = context;
  }

  public ProtocolResult.PurifyResult run(ProtocolInvocation.Purify invocation) {
    final var pairs = invocation.pairIds().stream().map(context.resources()::pair).toList();
    return purify(pairs, invocation.targetFidelity(), invocation.rounds());
  }

  public ProtocolResult.PurifyResult purify(List<EntanglementPair> pairs, double targetFidelity, int rounds) {
    if (pairs.isEmpty()) {
      throw new ConfigurationException("purification needs at least one pair");
    }
    if (rounds < 0) {
      throw new ConfigurationException("rounds must not be negative: " + rounds);
    }
    if (pairs.stream().map(EntanglementPair::id).distinct().count() != pairs.size()) {
      throw new ConfigurationException("purification pairs must be distinct: "
          + pairs.stream().map(EntanglementPair::id).toList());
    }
    final var resources = context.resources();
    final var first = pairs.get(0);
    for (var pair : pairs) {
      if (!resources.isLive(pair)) {
        throw new QubitStateException("entangled pair " + pair.id() + " has been consumed");
      }
      if (!pair.joins(first.nodeA(), first.nodeB())) {
        throw new ConfigurationException("pair " + pair.id() + " joins " + pair.nodes() + " not " + first.nodes());
      }
    }
    final var config = context.config();
    final var route = context.route(first.nodeA(), first.nodeB());
    var current = new ArrayList<>(pairs);
    double fidelity = pairs.stream().mapToDouble(EntanglementPair::fidelity).min().orElseThrow();
    int performed = 0;
    while (performed < rounds && fidelity < targetFidelity && current.size() >= 2) {
      final var next = new ArrayList<EntanglementPair>(current.size() / 2);
      final var outcomes = new ArrayList<Integer>();
      for (int i = 0; i < current.size(); i += 2) {
        if (i + 1 < current.size()) {
          next.add(current.get(i));
          outcomes.add(sacrifice(current.get(i + 1)));
        } else {
          outcomes.add(sacrifice(current.get(i)));
        }
      }
      context.relay().relay(route, ClassicalRelay.encodeBits(outcomes));
      fidelity = Math.max(fidelity, Math.min(config.purificationCap(), fidelity + config.purificationStep()));
      final double raised = fidelity;
      current = new ArrayList<>(next.stream().map(p -> resources.withFidelity(p, raised)).toList());
      performed++;
      final int round = performed;
      final int survivors = current.size();
      LOGGER.fine(() -> context.correlation() + " purification round " + round + " pairs=" + survivors
          + " fidelity=" + raised);
    }
    return new ProtocolResult.PurifyResult(Status.COMPLETED, pairs.size(), current.size(), fidelity, performed,
        current.stream().map(EntanglementPair::id).toList());
  }

  /// Measures the first half of the pair in Z and discards the second.
  private int sacrifice(EntanglementPair pair) {
    final var resources = context.resources();
    final int outcome = resources.measure(resources.qubit(pair.handleA()), Basis.Z, context.rng());
    resources.consume(pair, context.rng());
    return outcome;
  }
}
