// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;

/// A request to run one protocol. Dispatch is through [Visitor] so that adding a variant breaks every handler at
/// compile time.
public sealed interface ProtocolInvocation {

  <R> R accept(Visitor<R> visitor);

  /// The protocol name used in logs and the execution log.
  String protocol();

  interface Visitor<R> {
    R bb84(Bb84 bb84);

    R e91(E91 e91);

    R teleport(Teleport teleport);

    R entangle(Entangle entangle);

    R purify(Purify purify);

    R swap(Swap swap);

    R send(Send send);

    R receive(Receive receive);
  }

  /// @param securityThreshold the highest tolerated quantum bit error rate
  record Bb84(String alice, String bob, int keyLength, double securityThreshold) implements ProtocolInvocation {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.bb84(this);
    }

    @Override
    public String protocol() {
      return "bb84";
    }
  }

  record E91(String alice, String bob, int keyLength) implements ProtocolInvocation {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.e91(this);
    }

    @Override
    public String protocol() {
      return "e91";
    }
  }

  /// @param pairId an existing pair joining source and target, or null to establish one along the route
  record Teleport(String source, String target, String qubitId, @Nullable String pairId) implements ProtocolInvocation {
    public Teleport(String source, String target, String qubitId) {
      this(source, target, qubitId, null);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.teleport(this);
    }

    @Override
    public String protocol() {
      return "teleport";
    }
  }

  /// @param kind bell, ghz or cluster
  record Entangle(List<String> nodes, String kind, double fidelityThreshold, boolean purify, int purificationRounds)
      implements ProtocolInvocation {
    public Entangle {
      nodes = List.copyOf(nodes);
    }

    public Entangle(List<String> nodes, String kind, double fidelityThreshold) {
      this(nodes, kind, fidelityThreshold, false, 0);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.entangle(this);
    }

    @Override
    public String protocol() {
      return "entangle";
    }
  }

  record Purify(List<String> pairIds, double targetFidelity, int rounds) implements ProtocolInvocation {
    public Purify {
      pairIds = List.copyOf(pairIds);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.purify(this);
    }

    @Override
    public String protocol() {
      return "purify";
    }
  }

  /// @param measure false to leave the new pair uncorrected
  record Swap(String qubitA, String qubitB, boolean measure) implements ProtocolInvocation {
    public Swap(String qubitA, String qubitB) {
      this(qubitA, qubitB, true);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.swap(this);
    }

    @Override
    public String protocol() {
      return "swap";
    }
  }

  record Send(String channelId, String payload, String destination) implements ProtocolInvocation {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.send(this);
    }

    @Override
    public String protocol() {
      return "send";
    }
  }

  record Receive(String channelId, Duration timeout) implements ProtocolInvocation {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.receive(this);
    }

    @Override
    public String protocol() {
      return "receive";
    }
  }
}
