// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

import com.github.quantum_net.ConfigurationException;

public enum EntanglementKind {
  /// a Bell pair between each consecutive pair of listed nodes
  BELL,
  /// one GHZ state shared by all listed nodes
  GHZ,
  /// a graph state built by a pluggable [ClusterStateBuilder]
  CLUSTER;

  public static EntanglementKind fromString(String name) {
    if (name == null) {
      throw new ConfigurationException("entanglement kind is required");
    }
    try {
      return EntanglementKind.valueOf(name.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown entanglement kind: " + name + ". Valid options: bell, ghz, cluster");
    }
  }
}
