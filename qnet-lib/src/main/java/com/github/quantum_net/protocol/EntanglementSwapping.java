// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.QubitStateException;
import com.github.quantum_net.resource.EntanglementPair;
import com.github.quantum_net.resource.NetworkQubit;
import com.github.quantum_net.resource.QuantumResources;
import com.github.quantum_net.routing.Route;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Joins two pairs that meet at a repeater into one longer pair, and chains per hop pairs along a route into a pair
/// between its ends.
public final class EntanglementSwapping {
  private final ProtocolContext context;

  public EntanglementSwapping(ProtocolContext context) {
    this.context = context;
  }

  public ProtocolResult.SwapResult run(ProtocolInvocation.Swap invocation) {
    final var resources = context.resources();
    final var qubitA = resources.qubit(invocation.qubitA());
    final var qubitB = resources.qubit(invocation.qubitB());
    qubitA.checkLive();
    qubitB.checkLive();
    if (!qubitA.nodeId().equals(qubitB.nodeId())) {
      throw new QubitStateException("swap qubits " + qubitA.id() + "@" + qubitA.nodeId()
          + " and " + qubitB.id() + "@" + qubitB.nodeId() + " are not co-located");
    }
    final var first = livePairOf(qubitA);
    final var second = livePairOf(qubitB);
    if (first.id().equals(second.id())) {
      throw new QubitStateException("swap qubits " + qubitA.id() + " and " + qubitB.id() + " are the same pair");
    }
    final var swapped = swap(first, qubitA, second, qubitB, invocation.measure());
    final var pair = swapped.pair();
    final var bits = swapped.correctionBits();
    return new ProtocolResult.SwapResult(Status.COMPLETED, pair.id(), pair.nodes(), pair.fidelity(),
        bits == null ? null : Arrays.stream(bits).boxed().toList());
  }

  /// A single swap. When measuring, the two Bell measurement bits travel from the repeater to the far end of the
  /// second pair where the correction is applied.
  QuantumResources.SwapOutcome swap(EntanglementPair first, NetworkQubit middleA,
                                    EntanglementPair second, NetworkQubit middleB,
                                    boolean measure) {
    final var resources = context.resources();
    final var outcome = resources.swap(first, middleA, second, middleB, measure, context.rng());
    final var bits = outcome.correctionBits();
    if (bits != null) {
      final var farEnd = outcome.pair().nodeB();
      final var route = context.router().route(middleB.nodeId(), farEnd);
      context.relay().relay(route, ClassicalRelay.encodeBits(Arrays.stream(bits).boxed().toList()));
    }
    LOGGER.fine(() -> context.correlation() + " swapped " + first.id() + "+" + second.id() + " at " + middleA.nodeId()
        + " -> " + outcome.pair().id() + " " + outcome.pair().nodes() + " fidelity=" + outcome.pair().fidelity());
    return outcome;
  }

  /// Builds a pair between the ends of the route: one fresh pair per hop, then a swap at every intermediate node.
  ///
  /// @param hosted whether the pairs are registered with their nodes or are transient for this run
  /// @return every pair created, the end to end pair last
  public List<EntanglementPair> chain(Route route, boolean hosted) {
    if (route.hops() < 1) {
      throw new IllegalArgumentException("a chain needs at least one hop: " + route.nodes());
    }
    final var resources = context.resources();
    final var created = new ArrayList<EntanglementPair>();
    EntanglementPair current = null;
    for (int i = 0; i < route.hops(); i++) {
      final var left = route.nodes().get(i);
      final var right = route.nodes().get(i + 1);
      final var hop = hosted
          ? resources.createEntangledPair(context.node(left), context.node(right))
          : resources.createTransientPair(left, right);
      created.add(hop);
      if (current == null) {
        current = hop;
      } else {
        final var middleA = resources.qubit(current.qubitAt(left));
        final var middleB = resources.qubit(hop.qubitAt(left));
        current = swap(current, middleA, hop, middleB, true).pair();
        created.add(current);
      }
    }
    return created;
  }

  private EntanglementPair livePairOf(NetworkQubit qubit) {
    return context.resources().pairs().stream()
        .filter(p -> p.contains(qubit.id()))
        .filter(context.resources()::isLive)
        .findFirst()
        .orElseThrow(() -> new QubitStateException("qubit " + qubit.id() + " is not half of a live entangled pair"));
  }
}
