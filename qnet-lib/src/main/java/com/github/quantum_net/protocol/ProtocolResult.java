// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ErrorKind;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/// The immutable outcome of a protocol run.
public sealed interface ProtocolResult {

  String protocol();

  Status status();

  /// @return null unless the run was aborted or failed
  default @Nullable ErrorKind errorKind() {
    return null;
  }

  /// A one line human readable description used by logs and the execution log.
  String message();

  /// @param key null when aborted
  record Bb84Result(Status status,
                    QkdPhase phase,
                    int rawLength,
                    int siftedLength,
                    int finalLength,
                    double qber,
                    @Nullable List<Integer> key) implements ProtocolResult {
    public Bb84Result {
      key = key == null ? null : List.copyOf(key);
    }

    @Override
    public String protocol() {
      return "bb84";
    }

    @Override
    public @Nullable ErrorKind errorKind() {
      return status == Status.ABORTED ? ErrorKind.SECURITY_ABORTED : null;
    }

    @Override
    public String message() {
      return String.format("bb84 %s phase=%s raw=%d sifted=%d final=%d qber=%.4f",
          status, phase, rawLength, siftedLength, finalLength, qber);
    }
  }

  record E91Result(Status status,
                   int pairsCreated,
                   int keyLength,
                   double correlation,
                   double matchedCorrelation,
                   List<Integer> key) implements ProtocolResult {
    public E91Result {
      key = List.copyOf(key);
    }

    @Override
    public String protocol() {
      return "e91";
    }

    @Override
    public String message() {
      return String.format("e91 %s pairs=%d key=%d correlation=%.4f matched=%.4f",
          status, pairsCreated, keyLength, correlation, matchedCorrelation);
    }
  }

  record TeleportResult(Status status,
                        String source,
                        String target,
                        String qubitId,
                        String newQubitId,
                        String pairId,
                        List<Integer> classicalBits,
                        double fidelity,
                        int hops) implements ProtocolResult {
    public TeleportResult {
      classicalBits = List.copyOf(classicalBits);
    }

    @Override
    public String protocol() {
      return "teleport";
    }

    @Override
    public String message() {
      return String.format("teleport %s %s@%s -> %s@%s bits=%s fidelity=%.4f hops=%d",
          status, qubitId, source, newQubitId, target, classicalBits, fidelity, hops);
    }
  }

  record EntangleResult(Status status,
                        EntanglementKind kind,
                        List<String> nodes,
                        List<String> pairIds,
                        List<String> qubitIds,
                        double fidelity,
                        boolean meetsThreshold,
                        int purifications) implements ProtocolResult {
    public EntangleResult {
      nodes = List.copyOf(nodes);
      pairIds = List.copyOf(pairIds);
      qubitIds = List.copyOf(qubitIds);
    }

    @Override
    public String protocol() {
      return "entangle";
    }

    @Override
    public String message() {
      return String.format("entangle %s %s nodes=%s fidelity=%.4f meetsThreshold=%s purifications=%d",
          status, kind, nodes, fidelity, meetsThreshold, purifications);
    }
  }

  record PurifyResult(Status status,
                      int initialPairs,
                      int finalPairs,
                      double finalFidelity,
                      int roundsPerformed,
                      List<String> pairIds) implements ProtocolResult {
    public PurifyResult {
      pairIds = List.copyOf(pairIds);
    }

    @Override
    public String protocol() {
      return "purify";
    }

    @Override
    public String message() {
      return String.format("purify %s pairs %d -> %d fidelity=%.4f rounds=%d",
          status, initialPairs, finalPairs, finalFidelity, roundsPerformed);
    }
  }

  /// @param correctionBits null when the swap was left uncorrected
  record SwapResult(Status status,
                    String pairId,
                    List<String> endpoints,
                    double fidelity,
                    @Nullable List<Integer> correctionBits) implements ProtocolResult {
    public SwapResult {
      endpoints = List.copyOf(endpoints);
      correctionBits = correctionBits == null ? null : List.copyOf(correctionBits);
    }

    @Override
    public String protocol() {
      return "swap";
    }

    @Override
    public String message() {
      return String.format("swap %s %s endpoints=%s fidelity=%.4f", status, pairId, endpoints, fidelity);
    }
  }

  /// @param queueDepth the depth after the send or the capacity when not accepted
  record SendResult(Status status, boolean accepted, int queueDepth) implements ProtocolResult {
    @Override
    public String protocol() {
      return "send";
    }

    @Override
    public String message() {
      return "send " + status + " accepted=" + accepted + " depth=" + queueDepth;
    }
  }

  /// @param payload null when nothing arrived before the timeout
  record ReceiveResult(Status status, boolean received, @Nullable String payload) implements ProtocolResult {
    @Override
    public String protocol() {
      return "receive";
    }

    @Override
    public String message() {
      return "receive " + status + " received=" + received;
    }
  }

  record Failed(String protocol, ErrorKind errorKind, String message) implements ProtocolResult {
    @Override
    public Status status() {
      return Status.FAILED;
    }
  }
}
