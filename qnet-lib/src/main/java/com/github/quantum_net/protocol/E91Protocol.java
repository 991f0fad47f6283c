// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.resource.Basis;
import com.github.quantum_net.resource.EntanglementPair;
import com.github.quantum_net.resource.NetworkQubit;

import java.util.ArrayList;
import java.util.List;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Entanglement based key distribution. A source creates |Φ+> pairs, Bob's halves travel the route, both parties
/// measure in random Z/X bases and keep the outcomes where the bases agree. The correlation statistic is reported for
/// the first positions overall and for the matching basis positions, which should be near 1 on a clean route.
public final class E91Protocol {
  private final ProtocolContext context;

  public E91Protocol(ProtocolContext context) {
    this.context = context;
  }

  public ProtocolResult.E91Result run(ProtocolInvocation.E91 invocation) {
    if (invocation.keyLength() < 1) {
      throw new ConfigurationException("key length must be positive: " + invocation.keyLength());
    }
    final var alice = context.node(invocation.alice()).id();
    final var bob = context.node(invocation.bob()).id();
    final var route = context.route(alice, bob);
    final var resources = context.resources();
    final var rng = context.rng();
    final int n = 4 * invocation.keyLength();

    final var pairs = new ArrayList<EntanglementPair>(n);
    try {
      for (int i = 0; i < n; i++) {
        pairs.add(resources.createTransientPair(alice, bob));
      }
      final List<NetworkQubit> bobHalves = pairs.stream().map(p -> resources.qubit(p.handleB())).toList();
      for (var link : route.links()) {
        context.transport().applyLinkNoise(bobHalves, link.lossRate(), resources, rng);
      }

      final var aliceBases = new ArrayList<Basis>(n);
      final var bobBases = new ArrayList<Basis>(n);
      final var aliceOutcomes = new ArrayList<Integer>(n);
      final var bobOutcomes = new ArrayList<Integer>(n);
      for (var pair : pairs) {
        final var a = Basis.random(rng);
        final var b = Basis.random(rng);
        aliceBases.add(a);
        bobBases.add(b);
        aliceOutcomes.add(resources.measure(resources.qubit(pair.handleA()), a, rng));
        bobOutcomes.add(resources.measure(resources.qubit(pair.handleB()), b, rng));
      }

      final var announced = Bb84Protocol.decodeBases(context.relay().relay(route.reversed(), Bb84Protocol.encodeBases(bobBases)));
      final int sample = Math.min(context.config().e91CorrelationSample(), n);
      double sum = 0.0;
      for (int i = 0; i < sample; i++) {
        sum += sign(aliceOutcomes.get(i), bobOutcomes.get(i));
      }
      final double correlation = sum / sample;

      final var key = new ArrayList<Integer>();
      double matchedSum = 0.0;
      int matched = 0;
      for (int i = 0; i < n; i++) {
        if (aliceBases.get(i) == announced.get(i)) {
          matchedSum += sign(aliceOutcomes.get(i), bobOutcomes.get(i));
          matched++;
          if (key.size() < invocation.keyLength()) {
            key.add(aliceOutcomes.get(i));
          }
        }
      }
      final double matchedCorrelation = matched == 0 ? 0.0 : matchedSum / matched;
      final int matches = matched;
      LOGGER.fine(() -> context.correlation() + " e91 " + alice + "->" + bob + " pairs=" + n + " matched=" + matches);
      return new ProtocolResult.E91Result(Status.COMPLETED, n, key.size(), correlation, matchedCorrelation, key);
    } finally {
      pairs.forEach(resources::release);
    }
  }

  /// (-1)^(a+b)
  private static double sign(int a, int b) {
    return ((a + b) & 1) == 0 ? 1.0 : -1.0;
  }
}
