// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.network;

import com.github.quantum_net.resource.NetworkQubit;
import com.github.quantum_net.resource.Pauli;
import com.github.quantum_net.resource.QuantumResources;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.random.RandomGenerator;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Moves classical messages through channels and quantum states across links.
///
/// Sends never block: a full queue is reported as [SendOutcome.CapacityExceeded]. Receives block on the channel's
/// condition until a message arrives, the timeout elapses or the receive is cancelled. Channels are independent and
/// each has its own lock.
public final class ChannelTransport {
  private final Clock clock;

  public ChannelTransport(Clock clock) {
    this.clock = clock;
  }

  public SendOutcome send(Channel channel, String payload, String destination) {
    return send(channel, payload, destination, null);
  }

  public SendOutcome send(Channel channel, String payload, String destination, @Nullable String correlation) {
    channel.lock.lock();
    try {
      if (channel.queue.size() >= channel.capacity()) {
        LOGGER.fine(() -> "channel " + channel.id() + " full at " + channel.capacity());
        return new SendOutcome.CapacityExceeded(channel.capacity());
      }
      channel.queue.addLast(new Envelope(payload, destination, clock.instant(), correlation));
      channel.arrived.signalAll();
      final int depth = channel.queue.size();
      LOGGER.finest(() -> "queued on " + channel.id() + " for " + destination + " depth=" + depth);
      return new SendOutcome.Accepted(depth);
    } finally {
      channel.lock.unlock();
    }
  }

  /// Takes the oldest message. A zero timeout returns at once.
  public ReceiveOutcome receive(Channel channel, Duration timeout) {
    return await(channel, null, timeout, null);
  }

  /// Takes the oldest message carrying the correlation, leaving other messages queued in order.
  public ReceiveOutcome receiveMatching(Channel channel, String correlation, Duration timeout) {
    return await(channel, correlation, timeout, null);
  }

  /// Starts a receive on the executor which the caller can cancel.
  public PendingReceive receiveAsync(Channel channel, Duration timeout, Executor executor) {
    final var pending = new PendingReceive(channel);
    executor.execute(() -> {
      try {
        pending.complete(await(channel, null, timeout, pending));
      } catch (RuntimeException e) {
        pending.fail(e);
        throw e;
      }
    });
    return pending;
  }

  /// A cancelled pending receive never takes a message. Whether it was cancelled is decided under the channel lock
  /// so a message sent after `cancel()` stays queued.
  private ReceiveOutcome await(Channel channel, @Nullable String correlation, Duration timeout,
                               @Nullable PendingReceive pending) {
    long nanos = timeout.toNanos();
    channel.lock.lock();
    try {
      channel.waiting++;
      try {
        while (true) {
          if (pending != null && pending.isCancelled()) {
            return ReceiveOutcome.CANCELLED;
          }
          final var envelope = take(channel, correlation);
          if (envelope != null) {
            if (pending != null) pending.settle();
            return new ReceiveOutcome.Received(envelope);
          }
          if (nanos <= 0L) {
            if (pending != null) pending.settle();
            return ReceiveOutcome.TIMED_OUT;
          }
          nanos = channel.arrived.awaitNanos(nanos);
        }
      } finally {
        channel.waiting--;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.fine(() -> "receive on " + channel.id() + " interrupted");
      return ReceiveOutcome.CANCELLED;
    } finally {
      channel.lock.unlock();
    }
  }

  private static @Nullable Envelope take(Channel channel, @Nullable String correlation) {
    if (correlation == null) {
      return channel.queue.pollFirst();
    }
    final Iterator<Envelope> it = channel.queue.iterator();
    while (it.hasNext()) {
      final var envelope = it.next();
      if (correlation.equals(envelope.correlation())) {
        it.remove();
        return envelope;
      }
    }
    return null;
  }

  /// Depolarising noise of one link: each qubit independently suffers X, Y or Z (chosen uniformly) with
  /// probability `lossRate`.
  ///
  /// @return how many qubits were hit
  public int applyLinkNoise(List<NetworkQubit> qubits, double lossRate, QuantumResources resources,
                            RandomGenerator rng) {
    int errors = 0;
    for (var qubit : qubits) {
      if (rng.nextDouble() < lossRate) {
        resources.applyPauli(qubit, Pauli.randomError(rng));
        errors++;
      }
    }
    final int hit = errors;
    LOGGER.finest(() -> "link noise hit " + hit + " of " + qubits.size());
    return errors;
  }
}
