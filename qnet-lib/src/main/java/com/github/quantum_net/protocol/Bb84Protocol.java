// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.resource.Basis;
import com.github.quantum_net.resource.NetworkQubit;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Prepare and measure key distribution. Alice encodes random bits in random Z/X bases, the photons cross every link
/// of the route picking up that link's noise, Bob measures in his own random bases and the two sift by comparing
/// bases over the classical channels. A leading sample of the sifted key is disclosed to estimate the error rate and
/// the run aborts if the rate exceeds the security threshold.
public final class Bb84Protocol {
  private final ProtocolContext context;

  public Bb84Protocol(ProtocolContext context) {
    this.context = context;
  }

  public ProtocolResult.Bb84Result run(ProtocolInvocation.Bb84 invocation) {
    if (invocation.keyLength() < 1) {
      throw new ConfigurationException("key length must be positive: " + invocation.keyLength());
    }
    if (!(invocation.securityThreshold() >= 0.0 && invocation.securityThreshold() <= 1.0)) {
      throw new ConfigurationException("security threshold must be in [0,1]: " + invocation.securityThreshold());
    }
    final var alice = context.node(invocation.alice()).id();
    final var bob = context.node(invocation.bob()).id();
    final var route = context.route(alice, bob);
    final var rng = context.rng();
    final var resources = context.resources();
    final int raw = 4 * invocation.keyLength();

    phase(QkdPhase.PREPARING, raw);
    final var aliceBits = new ArrayList<Integer>(raw);
    final var aliceBases = new ArrayList<Basis>(raw);
    final var photons = new ArrayList<NetworkQubit>(raw);
    try {
      for (int i = 0; i < raw; i++) {
        final int bit = rng.nextBoolean() ? 1 : 0;
        final var basis = Basis.random(rng);
        final var photon = resources.allocateTransient(alice, alice + "_bb84");
        resources.applyBasisPreparation(photon, bit, basis);
        aliceBits.add(bit);
        aliceBases.add(basis);
        photons.add(photon);
      }

      phase(QkdPhase.TRANSMITTING, raw);
      for (var link : route.links()) {
        context.transport().applyLinkNoise(photons, link.lossRate(), resources, rng);
      }

      phase(QkdPhase.MEASURING, raw);
      final var bobBases = new ArrayList<Basis>(raw);
      final var bobBits = new ArrayList<Integer>(raw);
      for (var photon : photons) {
        final var basis = Basis.random(rng);
        bobBases.add(basis);
        bobBits.add(resources.measure(photon, basis, rng));
      }

      phase(QkdPhase.SIFTING, raw);
      final var relay = context.relay();
      final var announcedBobBases = decodeBases(relay.relay(route.reversed(), encodeBases(bobBases)));
      final var announcedAliceBases = decodeBases(relay.relay(route, encodeBases(aliceBases)));
      final var aliceKey = sift(aliceBits, aliceBases, announcedBobBases);
      final var bobKey = sift(bobBits, announcedAliceBases, bobBases);

      phase(QkdPhase.ERROR_ESTIMATION, aliceKey.size());
      final int sample = Math.min(context.config().qkdSampleSize(), aliceKey.size() / 2);
      final var disclosed = ClassicalRelay.decodeBits(relay.relay(route, ClassicalRelay.encodeBits(aliceKey.subList(0, sample))));
      int mismatches = 0;
      for (int i = 0; i < sample; i++) {
        if (!disclosed.get(i).equals(bobKey.get(i))) {
          mismatches++;
        }
      }
      final double qber = sample == 0 ? 0.0 : (double) mismatches / sample;

      if (qber > invocation.securityThreshold()) {
        phase(QkdPhase.ABORTED, sample);
        LOGGER.fine(() -> context.correlation() + " bb84 " + alice + "->" + bob + " aborted qber=" + qber
            + " threshold=" + invocation.securityThreshold());
        return new ProtocolResult.Bb84Result(Status.ABORTED, QkdPhase.ABORTED, raw, aliceKey.size(), 0, qber, null);
      }
      final var key = aliceKey.subList(sample, Math.min(aliceKey.size(), sample + invocation.keyLength()));
      phase(QkdPhase.KEY_ACCEPTED, key.size());
      return new ProtocolResult.Bb84Result(Status.COMPLETED, QkdPhase.KEY_ACCEPTED, raw, aliceKey.size(), key.size(),
          qber, key);
    } finally {
      photons.forEach(resources::release);
    }
  }

  /// Keeps the bits at positions where both bases agree, in order.
  public static List<Integer> sift(List<Integer> bits, List<Basis> aliceBases, List<Basis> bobBases) {
    if (bits.size() != aliceBases.size() || bits.size() != bobBases.size()) {
      throw new IllegalArgumentException("bits and bases differ in length: "
          + bits.size() + "," + aliceBases.size() + "," + bobBases.size());
    }
    final var sifted = new ArrayList<Integer>();
    for (int i = 0; i < bits.size(); i++) {
      if (aliceBases.get(i) == bobBases.get(i)) {
        sifted.add(bits.get(i));
      }
    }
    return sifted;
  }

  static String encodeBases(List<Basis> bases) {
    return bases.stream().map(Basis::name).collect(Collectors.joining());
  }

  static List<Basis> decodeBases(String payload) {
    return payload.chars().mapToObj(c -> Basis.valueOf(String.valueOf((char) c))).toList();
  }

  private void phase(QkdPhase phase, int size) {
    LOGGER.fine(() -> context.correlation() + " bb84 " + phase + " n=" + size);
  }
}
