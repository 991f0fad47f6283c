// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.UnknownReferenceException;
import com.github.quantum_net.resource.EntanglementPair;

import java.util.ArrayList;
import java.util.List;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Moves the state of a hosted qubit to a new qubit at the target using a shared pair and two classical bits.
///
/// Without a supplied pair a transient one is established for the run: directly when the nodes are adjacent and by
/// swapping along a repeater chain otherwise. The Bell measurement bits travel the route's classical channels and
/// the target applies the Pauli correction on arrival.
public final class TeleportationProtocol {
  private final ProtocolContext context;

  public TeleportationProtocol(ProtocolContext context) {
    this.context = context;
  }

  public ProtocolResult.TeleportResult run(ProtocolInvocation.Teleport invocation) {
    final var resources = context.resources();
    final var source = context.node(invocation.source());
    final var target = context.node(invocation.target());
    final var qubit = resources.qubit(invocation.qubitId());
    if (!source.hosts(qubit.id())) {
      throw new UnknownReferenceException("qubit " + qubit.id() + " is not hosted at " + source.id());
    }
    qubit.checkLive();
    final var route = context.route(source.id(), target.id());

    final var transientPairs = new ArrayList<EntanglementPair>();
    try {
      final EntanglementPair pair;
      if (invocation.pairId() != null) {
        pair = resources.pair(invocation.pairId());
        if (!pair.joins(source.id(), target.id())) {
          throw new ConfigurationException("pair " + pair.id() + " joins " + pair.nodes()
              + " not " + source.id() + " and " + target.id());
        }
        if (pair.contains(qubit.id())) {
          throw new ConfigurationException("qubit " + qubit.id() + " cannot be teleported over its own pair");
        }
      } else if (route.hops() == 1) {
        pair = resources.createTransientPair(source.id(), target.id());
        transientPairs.add(pair);
      } else {
        transientPairs.addAll(new EntanglementSwapping(context).chain(route, false));
        pair = transientPairs.get(transientPairs.size() - 1);
      }

      final var measurement = resources.bellMeasure(qubit, pair, source.id(), context.rng());
      final var sent = List.of(measurement.bits()[0], measurement.bits()[1]);
      final var bits = ClassicalRelay.decodeBits(context.relay().relay(route, ClassicalRelay.encodeBits(sent)));

      final var received = resources.takeOver(measurement.carrier(), target, resources.nextId(target.id() + "_tp"));
      resources.applyPauliCorrection(received, new int[]{bits.get(0), bits.get(1)});
      final double fidelity = Math.min(qubit.fidelity(), context.config().teleportFidelityBound());
      received.fidelity(fidelity);

      LOGGER.fine(() -> context.correlation() + " teleported " + qubit.id() + "@" + source.id()
          + " -> " + received.id() + "@" + target.id() + " bits=" + bits + " hops=" + route.hops());
      return new ProtocolResult.TeleportResult(Status.COMPLETED, source.id(), target.id(), qubit.id(), received.id(),
          pair.id(), bits, fidelity, route.hops());
    } finally {
      transientPairs.forEach(resources::release);
    }
  }
}
