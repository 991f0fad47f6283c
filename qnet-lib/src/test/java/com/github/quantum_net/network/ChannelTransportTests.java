// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.network;

import com.github.quantum_net.LoggerConfig;
import com.github.quantum_net.resource.Amplitudes;
import com.github.quantum_net.resource.NetworkQubit;
import com.github.quantum_net.resource.QuantumResources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.random.RandomGeneratorFactory;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

public class ChannelTransportTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  final ChannelTransport transport = new ChannelTransport(Clock.systemUTC());
  final Channel channel = new Channel("a-b/classical", "a-b", 3, 1.0, 1e9);
  final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void shutdown() {
    executor.shutdownNow();
  }

  @Test
  void zeroTimeoutOnAnEmptyChannelReturnsAtOnce() {
    final long start = System.nanoTime();
    assertThat(transport.receive(channel, Duration.ZERO)).isInstanceOf(ReceiveOutcome.TimedOut.class);
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(500));
  }

  @Test
  void messagesArriveInTheOrderSent() {
    transport.send(channel, "one", "b");
    transport.send(channel, "two", "b");
    transport.send(channel, "three", "b");
    assertThat(IntStream.range(0, 3)
        .mapToObj(i -> ((ReceiveOutcome.Received) transport.receive(channel, Duration.ZERO)).envelope().payload())
        .toList()).containsExactly("one", "two", "three");
  }

  @Test
  void fullQueueRejectsWithoutBlocking() {
    for (int i = 0; i < 3; i++) {
      assertThat(transport.send(channel, "m" + i, "b")).isEqualTo(new SendOutcome.Accepted(i + 1));
    }
    assertThat(transport.send(channel, "overflow", "b")).isEqualTo(new SendOutcome.CapacityExceeded(3));
    assertThat(channel.depth()).isEqualTo(3);
    assertThat(channel.busy()).isTrue();
  }

  @Test
  void blockedReceiverWakesOnSend() throws Exception {
    final var pending = executor.submit(() -> transport.receive(channel, Duration.ofSeconds(10)));
    Thread.sleep(100);
    transport.send(channel, "hello", "b");
    final var outcome = pending.get(5, TimeUnit.SECONDS);
    assertThat(outcome).isInstanceOf(ReceiveOutcome.Received.class);
    assertThat(((ReceiveOutcome.Received) outcome).envelope().payload()).isEqualTo("hello");
  }

  @Test
  void receiveTimesOutAfterItsDeadline() {
    final long start = System.nanoTime();
    assertThat(transport.receive(channel, Duration.ofMillis(50))).isEqualTo(ReceiveOutcome.TIMED_OUT);
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(45));
  }

  @Test
  void cancellingLeavesQueuedMessagesAlone() throws Exception {
    final var pending = transport.receiveAsync(channel, Duration.ofSeconds(30), executor);
    Thread.sleep(50);
    assertThat(pending.cancel()).isTrue();
    assertThat(pending.outcome().get(5, TimeUnit.SECONDS)).isEqualTo(ReceiveOutcome.CANCELLED);
    transport.send(channel, "kept", "b");
    transport.send(channel, "also kept", "b");
    assertThat(channel.depth()).isEqualTo(2);
    assertThat(((ReceiveOutcome.Received) transport.receive(channel, Duration.ZERO)).envelope().payload())
        .isEqualTo("kept");
  }

  @Test
  void receiveCancelledBeforeItRunsTakesNothing() throws Exception {
    final List<Runnable> deferred = new ArrayList<>();
    final var pending = transport.receiveAsync(channel, Duration.ofSeconds(5), deferred::add);
    transport.send(channel, "keep-me", "b");
    assertThat(pending.cancel()).isTrue();
    deferred.forEach(Runnable::run);
    assertThat(pending.outcome().get(1, TimeUnit.SECONDS)).isEqualTo(ReceiveOutcome.CANCELLED);
    assertThat(channel.depth()).isEqualTo(1);
    assertThat(((ReceiveOutcome.Received) transport.receive(channel, Duration.ZERO)).envelope().payload())
        .isEqualTo("keep-me");
  }

  @Test
  void cancelAfterATimeoutReportsFalse() throws Exception {
    final var pending = transport.receiveAsync(channel, Duration.ZERO, Runnable::run);
    assertThat(pending.outcome().get(1, TimeUnit.SECONDS)).isEqualTo(ReceiveOutcome.TIMED_OUT);
    assertThat(pending.cancel()).isFalse();
  }

  @Test
  void asyncReceiveCompletesWhenAMessageArrives() throws Exception {
    final var pending = transport.receiveAsync(channel, Duration.ofSeconds(10), executor);
    transport.send(channel, "late", "b");
    final var outcome = pending.outcome().get(5, TimeUnit.SECONDS);
    assertThat(((ReceiveOutcome.Received) outcome).envelope().payload()).isEqualTo("late");
    assertThat(pending.cancel()).isFalse();
  }

  @Test
  void matchingReceiveSkipsOtherRuns() {
    transport.send(channel, "theirs", "b", "run-1");
    transport.send(channel, "mine", "b", "run-2");
    transport.send(channel, "theirs too", "b", "run-1");
    final var outcome = transport.receiveMatching(channel, "run-2", Duration.ZERO);
    assertThat(((ReceiveOutcome.Received) outcome).envelope().payload()).isEqualTo("mine");
    assertThat(transport.receiveMatching(channel, "run-2", Duration.ZERO)).isEqualTo(ReceiveOutcome.TIMED_OUT);
    assertThat(((ReceiveOutcome.Received) transport.receive(channel, Duration.ZERO)).envelope().payload())
        .isEqualTo("theirs");
    assertThat(((ReceiveOutcome.Received) transport.receive(channel, Duration.ZERO)).envelope().payload())
        .isEqualTo("theirs too");
  }

  @Test
  void linkNoiseHitsAtTheLossRate() {
    final var resources = new QuantumResources(Clock.systemUTC(), 0.95);
    final var rng = RandomGeneratorFactory.of("L64X128MixRandom").create(42);
    final List<NetworkQubit> qubits = IntStream.range(0, 1000)
        .mapToObj(i -> resources.allocateTransient("a", "photon"))
        .toList();
    assertThat(transport.applyLinkNoise(qubits, 0.0, resources, rng)).isZero();
    qubits.forEach(q -> assertThat(q.amplitudes()).isEqualTo(Amplitudes.ZERO));
    assertThat(transport.applyLinkNoise(qubits, 1.0, resources, rng)).isEqualTo(1000);
    assertThat(transport.applyLinkNoise(qubits, 0.25, resources, rng)).isBetween(150, 350);
  }
}
