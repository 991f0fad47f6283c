// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ErrorKind;
import com.github.quantum_net.LoggerConfig;
import com.github.quantum_net.QuantumNetEngine;
import com.github.quantum_net.TestNetworks;
import com.github.quantum_net.protocol.ProtocolResult.EntangleResult;
import com.github.quantum_net.resource.Basis;
import com.github.quantum_net.topology.NetworkSpec;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.random.RandomGeneratorFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class EntanglementDistributionTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  private static NetworkSpec line() {
    return TestNetworks.withMemory(TestNetworks.line(0), 16, "alice", "repeater", "bob");
  }

  @Test
  void bellPairAcrossARepeater() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(3), line())) {
      final var result = (EntangleResult) engine.execute(
          new ProtocolInvocation.Entangle(List.of("alice", "bob"), "bell", 0.9));
      assertThat(result.status()).isEqualTo(Status.COMPLETED);
      assertThat(result.kind()).isEqualTo(EntanglementKind.BELL);
      assertThat(result.pairIds()).hasSize(1);
      assertThat(result.fidelity()).isCloseTo(0.9025, within(1e-12));
      assertThat(result.meetsThreshold()).isTrue();
      final var pair = engine.resources().pair(result.pairIds().get(0));
      assertThat(pair.nodes()).containsExactlyInAnyOrder("alice", "bob");
      assertThat(engine.resources().isLive(pair)).isTrue();
    }
  }

  @Test
  void purifiedBellPairReachesTheCap() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(3), line())) {
      final var result = (EntangleResult) engine.execute(
          new ProtocolInvocation.Entangle(List.of("alice", "bob"), "bell", 0.99, true, 2));
      assertThat(result.purifications()).isEqualTo(2);
      assertThat(result.pairIds()).hasSize(1);
      assertThat(result.fidelity()).isCloseTo(0.99, within(1e-12));
      assertThat(result.meetsThreshold()).isTrue();
    }
  }

  @Test
  void ghzMembersAgreeInZ() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(9), line())) {
      final var result = (EntangleResult) engine.execute(
          new ProtocolInvocation.Entangle(List.of("alice", "repeater", "bob"), "GHZ", 0.9));
      assertThat(result.status()).isEqualTo(Status.COMPLETED);
      assertThat(result.qubitIds()).hasSize(3);
      assertThat(result.pairIds()).isEmpty();
      final var resources = engine.resources();
      final var rng = RandomGeneratorFactory.of("L64X128MixRandom").create(9);
      final var outcomes = result.qubitIds().stream()
          .map(id -> resources.measure(resources.qubit(id), Basis.Z, rng))
          .distinct()
          .toList();
      assertThat(outcomes).hasSize(1);
    }
  }

  @Test
  void clusterNeedsABuilder() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(1), line())) {
      final var result = engine.execute(new ProtocolInvocation.Entangle(List.of("alice", "bob"), "cluster", 0.5));
      assertThat(result.errorKind()).isEqualTo(ErrorKind.CONFIGURATION);
    }
    final var config = TestNetworks.quiet(1).withClusterStateBuilder((nodes, resources, rng) -> nodes.stream()
        .map(n -> resources.claim(n, resources.nextId(n.id() + "_c")))
        .toList());
    try (var engine = QuantumNetEngine.create(config, line())) {
      final var result = (EntangleResult) engine.execute(
          new ProtocolInvocation.Entangle(List.of("alice", "bob"), "cluster", 0.5));
      assertThat(result.status()).isEqualTo(Status.COMPLETED);
      assertThat(result.kind()).isEqualTo(EntanglementKind.CLUSTER);
      assertThat(result.qubitIds()).hasSize(2);
    }
  }

  @Test
  void invalidRequestsFail() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(1), TestNetworks.pair(0))) {
      assertThat(engine.execute(new ProtocolInvocation.Entangle(List.of("alice", "bob"), "ghz", 0.5)).errorKind())
          .isEqualTo(ErrorKind.RESOURCE);
      assertThat(engine.execute(new ProtocolInvocation.Entangle(List.of("alice"), "bell", 0.5)).errorKind())
          .isEqualTo(ErrorKind.CONFIGURATION);
      assertThat(engine.execute(new ProtocolInvocation.Entangle(List.of("alice", "alice"), "bell", 0.5)).errorKind())
          .isEqualTo(ErrorKind.CONFIGURATION);
      assertThat(engine.execute(new ProtocolInvocation.Entangle(List.of("alice", "bob"), "w-state", 0.5)).errorKind())
          .isEqualTo(ErrorKind.CONFIGURATION);
      assertThat(engine.execute(new ProtocolInvocation.Entangle(List.of("alice", "carol"), "bell", 0.5)).errorKind())
          .isEqualTo(ErrorKind.REFERENCE);
    }
  }

  @Test
  void purificationRoundsAreBoundedBeforeAnyPairIsMade() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(1), line())) {
      for (int rounds : new int[]{-1, 31, 32}) {
        assertThat(engine.execute(
            new ProtocolInvocation.Entangle(List.of("alice", "bob"), "bell", 0.99, true, rounds)).errorKind())
            .isEqualTo(ErrorKind.CONFIGURATION);
      }
      assertThat(engine.execute(
          new ProtocolInvocation.Entangle(List.of("alice", "bob"), "bell", 0.99, true, 5)).errorKind())
          .isEqualTo(ErrorKind.RESOURCE);
      assertThat(engine.resources().pairs()).isEmpty();
    }
  }
}
