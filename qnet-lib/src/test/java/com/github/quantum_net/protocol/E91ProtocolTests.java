// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ErrorKind;
import com.github.quantum_net.LoggerConfig;
import com.github.quantum_net.QuantumNetEngine;
import com.github.quantum_net.TestNetworks;
import com.github.quantum_net.protocol.ProtocolResult.E91Result;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class E91ProtocolTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  @Test
  void matchingBasesAgreeOnACleanRoute() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(3), TestNetworks.line(1))) {
      final var result = (E91Result) engine.execute(new ProtocolInvocation.E91("alice", "bob", 64));
      assertThat(result.status()).isEqualTo(Status.COMPLETED);
      assertThat(result.pairsCreated()).isEqualTo(256);
      assertThat(result.matchedCorrelation()).isEqualTo(1.0);
      assertThat(result.keyLength()).isEqualTo(64);
      assertThat(result.key()).hasSize(64);
      // half the positions use different bases and are uncorrelated
      assertThat(result.correlation()).isBetween(0.2, 0.8);
      assertThat(engine.resources().qubitCount()).isEqualTo(3);
    }
  }

  @Test
  void noiseBreaksTheCorrelation() {
    final var config = TestNetworks.quiet(5).withDefaultLossRate(0.6);
    try (var engine = QuantumNetEngine.create(config, TestNetworks.pair(1))) {
      final var result = (E91Result) engine.execute(new ProtocolInvocation.E91("alice", "bob", 64));
      assertThat(result.matchedCorrelation()).isLessThan(0.8);
    }
  }

  @Test
  void unknownPartyIsAReferenceError() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(5), TestNetworks.pair(1))) {
      final var result = engine.execute(new ProtocolInvocation.E91("alice", "eve", 8));
      assertThat(result.status()).isEqualTo(Status.FAILED);
      assertThat(result.errorKind()).isEqualTo(ErrorKind.REFERENCE);
    }
  }
}
