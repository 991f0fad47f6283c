// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ErrorKind;
import com.github.quantum_net.LoggerConfig;
import com.github.quantum_net.QuantumNetEngine;
import com.github.quantum_net.TestNetworks;
import com.github.quantum_net.protocol.ProtocolResult.Bb84Result;
import com.github.quantum_net.resource.Basis;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.LongStream;

import static com.github.quantum_net.resource.Basis.X;
import static com.github.quantum_net.resource.Basis.Z;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Bb84ProtocolTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  @Test
  void siftKeepsMatchingBases() {
    assertThat(Bb84Protocol.sift(List.of(0, 1, 0, 1), List.of(Z, Z, X, X), List.of(Z, X, X, Z)))
        .containsExactly(0, 0);
    assertThat(Bb84Protocol.sift(List.of(), List.<Basis>of(), List.<Basis>of())).isEmpty();
    assertThatThrownBy(() -> Bb84Protocol.sift(List.of(1), List.of(Z, X), List.of(Z)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void noiselessLinksGiveAFullKeyWithNoErrors() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(7), TestNetworks.line(1))) {
      final var result = (Bb84Result) engine.execute(new ProtocolInvocation.Bb84("alice", "bob", 128, 0.11));
      assertThat(result.status()).isEqualTo(Status.COMPLETED);
      assertThat(result.phase()).isEqualTo(QkdPhase.KEY_ACCEPTED);
      assertThat(result.qber()).isZero();
      assertThat(result.rawLength()).isEqualTo(512);
      assertThat(result.finalLength()).isEqualTo(128);
      assertThat(result.key()).hasSize(128).allMatch(bit -> bit == 0 || bit == 1);
      assertThat(result.errorKind()).isNull();
    }
  }

  @Test
  void heavyNoiseAbortsWithoutAKey() {
    final var config = TestNetworks.quiet(11).withDefaultLossRate(0.75);
    try (var engine = QuantumNetEngine.create(config, TestNetworks.pair(1))) {
      final var result = (Bb84Result) engine.execute(new ProtocolInvocation.Bb84("alice", "bob", 64, 0.11));
      assertThat(result.status()).isEqualTo(Status.ABORTED);
      assertThat(result.phase()).isEqualTo(QkdPhase.ABORTED);
      assertThat(result.errorKind()).isEqualTo(ErrorKind.SECURITY_ABORTED);
      assertThat(result.qber()).isGreaterThan(0.11);
      assertThat(result.key()).isNull();
      assertThat(result.finalLength()).isZero();
    }
  }

  @Test
  void errorRateGrowsWithLoss() {
    final double quiet = averageQber(0.0);
    final double noisy = averageQber(0.2);
    final double noisier = averageQber(0.5);
    assertThat(quiet).isZero();
    assertThat(noisy).isGreaterThan(quiet);
    assertThat(noisier).isGreaterThan(noisy);
    // two thirds of the Pauli errors flip the encoded bit
    assertThat(noisier).isBetween(0.25, 0.42);
  }

  private static double averageQber(double lossRate) {
    return LongStream.range(0, 5).mapToDouble(seed -> {
      final var config = TestNetworks.quiet(seed).withDefaultLossRate(lossRate).withQkdSampleSize(1_000);
      try (var engine = QuantumNetEngine.create(config, TestNetworks.pair(1))) {
        return ((Bb84Result) engine.execute(new ProtocolInvocation.Bb84("alice", "bob", 256, 1.0))).qber();
      }
    }).average().orElseThrow();
  }

  @Test
  void sameSeedSameKey() {
    List<Integer> first;
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(99), TestNetworks.pair(1))) {
      first = ((Bb84Result) engine.execute(new ProtocolInvocation.Bb84("alice", "bob", 32, 0.11))).key();
    }
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(99), TestNetworks.pair(1))) {
      assertThat(((Bb84Result) engine.execute(new ProtocolInvocation.Bb84("alice", "bob", 32, 0.11))).key())
          .isEqualTo(first);
    }
  }

  @Test
  void badArgumentsFail() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(1), TestNetworks.pair(1))) {
      assertThat(engine.execute(new ProtocolInvocation.Bb84("alice", "mallory", 8, 0.11)).errorKind())
          .isEqualTo(ErrorKind.REFERENCE);
      assertThat(engine.execute(new ProtocolInvocation.Bb84("alice", "bob", 0, 0.11)).errorKind())
          .isEqualTo(ErrorKind.CONFIGURATION);
      assertThat(engine.execute(new ProtocolInvocation.Bb84("alice", "alice", 8, 0.11)).errorKind())
          .isEqualTo(ErrorKind.CONFIGURATION);
      assertThat(engine.resources().qubitCount()).isEqualTo(2);
    }
  }
}
