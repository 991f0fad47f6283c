// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.EngineConfig;
import com.github.quantum_net.network.ChannelTransport;
import com.github.quantum_net.network.ReceiveOutcome;
import com.github.quantum_net.network.SendOutcome;
import com.github.quantum_net.resource.QuantumResources;
import com.github.quantum_net.routing.Router;
import com.github.quantum_net.topology.Network;

import java.util.random.RandomGenerator;

/// Dispatches an invocation to its protocol. Exceptions are left to the caller which turns them into failed results.
public final class ProtocolEngine {
  private final Network network;
  private final QuantumResources resources;
  private final ChannelTransport transport;
  private final Router router;
  private final EngineConfig config;

  public ProtocolEngine(Network network, QuantumResources resources, ChannelTransport transport, Router router,
                        EngineConfig config) {
    this.network = network;
    this.resources = resources;
    this.transport = transport;
    this.router = router;
    this.config = config;
  }

  /// Runs one protocol on the calling thread.
  ///
  /// @param rng         this run's own generator
  /// @param correlation tags this run's classical messages
  public ProtocolResult run(ProtocolInvocation invocation, RandomGenerator rng, String correlation) {
    final var context = new ProtocolContext(network, resources, transport, router, config, rng, correlation);
    return invocation.accept(new Dispatch(context));
  }

  private record Dispatch(ProtocolContext context) implements ProtocolInvocation.Visitor<ProtocolResult> {
    @Override
    public ProtocolResult bb84(ProtocolInvocation.Bb84 bb84) {
      return new Bb84Protocol(context).run(bb84);
    }

    @Override
    public ProtocolResult e91(ProtocolInvocation.E91 e91) {
      return new E91Protocol(context).run(e91);
    }

    @Override
    public ProtocolResult teleport(ProtocolInvocation.Teleport teleport) {
      return new TeleportationProtocol(context).run(teleport);
    }

    @Override
    public ProtocolResult entangle(ProtocolInvocation.Entangle entangle) {
      return new EntanglementDistribution(context).run(entangle);
    }

    @Override
    public ProtocolResult purify(ProtocolInvocation.Purify purify) {
      return new PurificationProtocol(context).run(purify);
    }

    @Override
    public ProtocolResult swap(ProtocolInvocation.Swap swap) {
      return new EntanglementSwapping(context).run(swap);
    }

    @Override
    public ProtocolResult send(ProtocolInvocation.Send send) {
      final var channel = context.network().channel(send.channelId());
      final var outcome = context.transport().send(channel, send.payload(), send.destination());
      if (outcome instanceof SendOutcome.Accepted accepted) {
        return new ProtocolResult.SendResult(Status.COMPLETED, true, accepted.queueDepth());
      }
      return new ProtocolResult.SendResult(Status.COMPLETED, false, channel.capacity());
    }

    @Override
    public ProtocolResult receive(ProtocolInvocation.Receive receive) {
      final var channel = context.network().channel(receive.channelId());
      final var outcome = context.transport().receive(channel, receive.timeout());
      if (outcome instanceof ReceiveOutcome.Received received) {
        return new ProtocolResult.ReceiveResult(Status.COMPLETED, true, received.envelope().payload());
      }
      return new ProtocolResult.ReceiveResult(Status.COMPLETED, false, null);
    }
  }
}
