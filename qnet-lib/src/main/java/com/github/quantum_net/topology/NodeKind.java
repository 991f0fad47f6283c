// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.topology;

import com.github.quantum_net.ConfigurationException;

/// The role of a node. Only reported; the engine treats all kinds alike.
public enum NodeKind {
  ENDPOINT, REPEATER, ROUTER, SERVER;

  /// Case insensitive parse.
  ///
  /// @throws ConfigurationException if the name is not a node kind
  public static NodeKind fromString(String name) {
    if (name == null) {
      throw new ConfigurationException("node kind is required");
    }
    try {
      return NodeKind.valueOf(name.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown node kind: " + name + ". Valid options: endpoint, repeater, router, server");
    }
  }
}
