// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ChannelCapacityException;
import com.github.quantum_net.ReceiveTimeoutException;
import com.github.quantum_net.network.ChannelTransport;
import com.github.quantum_net.network.ReceiveOutcome;
import com.github.quantum_net.network.SendOutcome;
import com.github.quantum_net.routing.Route;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Carries a protocol's classical messages hop by hop along a route: each hop is a send on the link's classical
/// channel followed by the next node's receive of the message tagged with the run's correlation id.
public final class ClassicalRelay {
  private final ChannelTransport transport;
  private final String correlation;
  private final Duration timeout;

  ClassicalRelay(ChannelTransport transport, String correlation, Duration timeout) {
    this.transport = transport;
    this.correlation = correlation;
    this.timeout = timeout;
  }

  /// @return the payload as received at the end of the route
  /// @throws ChannelCapacityException if a hop's channel is full
  /// @throws ReceiveTimeoutException  if a hop's message does not arrive in time
  public String relay(Route route, String payload) {
    var carried = payload;
    for (int i = 0; i < route.hops(); i++) {
      final var channel = route.links().get(i).classicalChannel();
      final var next = route.nodes().get(i + 1);
      final var sent = transport.send(channel, carried, next, correlation);
      if (sent instanceof SendOutcome.CapacityExceeded full) {
        throw new ChannelCapacityException("channel " + channel.id() + " is full at capacity " + full.capacity());
      }
      final var received = transport.receiveMatching(channel, correlation, timeout);
      if (received instanceof ReceiveOutcome.Received r) {
        carried = r.envelope().payload();
      } else {
        throw new ReceiveTimeoutException("no message for " + next + " on " + channel.id() + " within " + timeout);
      }
    }
    final int hops = route.hops();
    LOGGER.finest(() -> correlation + " relayed " + payload.length() + " chars over " + hops + " hops");
    return carried;
  }

  static String encodeBits(List<Integer> bits) {
    return bits.stream().map(String::valueOf).collect(Collectors.joining());
  }

  static List<Integer> decodeBits(String payload) {
    return payload.chars().map(c -> c - '0').boxed().toList();
  }
}
