// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

import com.github.quantum_net.log.ExecutionRecord;
import com.github.quantum_net.log.MVStoreExecutionLog;
import com.github.quantum_net.protocol.ProtocolInvocation;
import com.github.quantum_net.protocol.ProtocolResult;
import com.github.quantum_net.protocol.ProtocolResult.Bb84Result;
import com.github.quantum_net.protocol.ProtocolResult.ReceiveResult;
import com.github.quantum_net.protocol.ProtocolResult.SendResult;
import com.github.quantum_net.protocol.Status;
import com.github.quantum_net.topology.NetworkSpec;
import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QuantumNetEngineTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  @Test
  void invalidConfigIsRejected() {
    assertThatThrownBy(() -> QuantumNetEngine.create(TestNetworks.quiet(1).withPairFidelity(1.5), TestNetworks.pair(1)))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("pairFidelity");
    assertThatThrownBy(() -> QuantumNetEngine.create(TestNetworks.quiet(1).withE91CorrelationSample(0), TestNetworks.pair(1)))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void failuresBecomeResultsAndAreLogged() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(1), TestNetworks.pair(1))) {
      final var result = engine.execute(new ProtocolInvocation.Bb84("alice", "carol", 8, 0.11));
      assertThat(result).isInstanceOf(ProtocolResult.Failed.class);
      assertThat(result.status()).isEqualTo(Status.FAILED);
      assertThat(result.errorKind()).isEqualTo(ErrorKind.REFERENCE);
      assertThat(engine.executionLog().records()).singleElement().satisfies(r -> {
        assertThat(r.protocol()).isEqualTo("bb84");
        assertThat(r.status()).isEqualTo(Status.FAILED);
        assertThat(r.errorKind()).isEqualTo(ErrorKind.REFERENCE);
      });
    }
  }

  @Test
  void concurrentRunsOnDisjointAndSharedRoutes() {
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(21), TestNetworks.mesh(4, 0))) {
      final List<CompletableFuture<ProtocolResult>> futures = List.of(
          engine.submit(new ProtocolInvocation.Bb84("n0", "n1", 32, 0.11)),
          engine.submit(new ProtocolInvocation.Bb84("n2", "n3", 32, 0.11)),
          engine.submit(new ProtocolInvocation.Bb84("n0", "n1", 32, 0.11)),
          engine.submit(new ProtocolInvocation.Bb84("n1", "n0", 32, 0.11)));
      final var results = futures.stream().map(CompletableFuture::join).toList();
      assertThat(results).allSatisfy(r -> {
        assertThat(r.status()).isEqualTo(Status.COMPLETED);
        assertThat(((Bb84Result) r).qber()).isZero();
      });
      assertThat(engine.executionLog().records())
          .extracting(ExecutionRecord::sequence)
          .containsExactly(1L, 2L, 3L, 4L);
    }
  }

  @Test
  void sameSeedSameKey() {
    final var invocation = new ProtocolInvocation.Bb84("alice", "bob", 24, 0.11);
    try (var first = QuantumNetEngine.create(TestNetworks.quiet(99), TestNetworks.pair(1));
         var second = QuantumNetEngine.create(TestNetworks.quiet(99), TestNetworks.pair(1))) {
      final var a = (Bb84Result) first.execute(invocation);
      final var b = (Bb84Result) second.execute(invocation);
      assertThat(a.key()).isEqualTo(b.key());
    }
  }

  @Test
  void rawSendAndReceive() {
    final var spec = new NetworkSpec("tight", "ring", TestNetworks.pair(1).nodes(), List.of(
        new NetworkSpec.LinkSpec("alice", "bob", 1.0, 0.0, List.of(new NetworkSpec.ChannelSpec("ab", 2, 1.0, 1e9)))));
    try (var engine = QuantumNetEngine.create(TestNetworks.quiet(1).withClassicalTimeout(Duration.ofMillis(200)), spec)) {
      final var sends = IntStream.range(0, 3)
          .mapToObj(i -> (SendResult) engine.execute(new ProtocolInvocation.Send("ab", "m" + i, "bob")))
          .toList();
      assertThat(sends).extracting(SendResult::accepted).containsExactly(true, true, false);
      assertThat(sends).extracting(SendResult::queueDepth).containsExactly(1, 2, 2);

      final var first = (ReceiveResult) engine.execute(new ProtocolInvocation.Receive("ab", Duration.ofMillis(50)));
      assertThat(first.received()).isTrue();
      assertThat(first.payload()).isEqualTo("m0");
      engine.execute(new ProtocolInvocation.Receive("ab", Duration.ofMillis(50)));
      final var empty = (ReceiveResult) engine.execute(new ProtocolInvocation.Receive("ab", Duration.ofMillis(20)));
      assertThat(empty.status()).isEqualTo(Status.COMPLETED);
      assertThat(empty.received()).isFalse();
      assertThat(empty.payload()).isNull();

      assertThat(engine.execute(new ProtocolInvocation.Send("nowhere", "m", "bob")).errorKind())
          .isEqualTo(ErrorKind.REFERENCE);
    }
  }

  @Test
  void sequenceContinuesFromAPersistentLog() {
    try (var store = MVStore.open(null)) {
      final var config = TestNetworks.quiet(5).withExecutionLog(new MVStoreExecutionLog(store));
      try (var engine = QuantumNetEngine.create(config, TestNetworks.pair(1))) {
        engine.execute(new ProtocolInvocation.Bb84("alice", "bob", 8, 0.11));
        engine.execute(new ProtocolInvocation.Bb84("alice", "bob", 8, 0.11));
      }
      try (var engine = QuantumNetEngine.create(config, TestNetworks.pair(1))) {
        engine.execute(new ProtocolInvocation.E91("alice", "bob", 8));
        assertThat(engine.executionLog().highestSequence()).isEqualTo(3);
        assertThat(engine.executionLog().read(3)).get().extracting(ExecutionRecord::protocol).isEqualTo("e91");
      }
    }
  }
}
