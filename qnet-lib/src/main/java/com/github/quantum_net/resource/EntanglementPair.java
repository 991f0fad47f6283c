// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import com.github.quantum_net.QubitStateException;
import lombok.With;

import java.time.Instant;
import java.util.List;

/// Bookkeeping for two qubits at two nodes that share a Bell state. The record only refers to its qubits; the
/// joint state lives in their [EntangledState].
///
/// @param hosted whether the halves are registered with their nodes or are transient protocol qubits
@With
public record EntanglementPair(String id,
                               Handle handle,
                               String qubitA,
                               Handle handleA,
                               String nodeA,
                               String qubitB,
                               Handle handleB,
                               String nodeB,
                               double fidelity,
                               Instant createdAt,
                               boolean hosted) {

  public EntanglementPair {
    if (fidelity < 0.0 || fidelity > 1.0) {
      throw new IllegalArgumentException("fidelity must be in [0,1]: " + fidelity);
    }
  }

  public List<String> nodes() {
    return List.of(nodeA, nodeB);
  }

  public boolean joins(String first, String second) {
    return (nodeA.equals(first) && nodeB.equals(second)) || (nodeA.equals(second) && nodeB.equals(first));
  }

  public boolean contains(String qubitId) {
    return qubitA.equals(qubitId) || qubitB.equals(qubitId);
  }

  /// @return the id of the half that is not the given one.
  public String partnerOf(String qubitId) {
    if (qubitA.equals(qubitId)) return qubitB;
    if (qubitB.equals(qubitId)) return qubitA;
    throw new QubitStateException("qubit " + qubitId + " is not part of pair " + id);
  }

  /// @return the id of the half held at the given node.
  public String qubitAt(String nodeId) {
    if (nodeA.equals(nodeId)) return qubitA;
    if (nodeB.equals(nodeId)) return qubitB;
    throw new QubitStateException("pair " + id + " has no half at " + nodeId);
  }
}
