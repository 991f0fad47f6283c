// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.topology;

import com.github.quantum_net.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/// How the builder fills in links between nodes that were not explicitly linked.
public enum TopologyKind {
  /// every unordered pair
  MESH {
    @Override
    List<int[]> pairs(int n) {
      final var pairs = new ArrayList<int[]>();
      for (int i = 0; i < n; i++) {
        for (int j = i + 1; j < n; j++) {
          pairs.add(new int[]{i, j});
        }
      }
      return pairs;
    }
  },
  /// the first node is the hub
  STAR {
    @Override
    List<int[]> pairs(int n) {
      final var pairs = new ArrayList<int[]>();
      for (int i = 1; i < n; i++) {
        pairs.add(new int[]{0, i});
      }
      return pairs;
    }
  },
  RING {
    @Override
    List<int[]> pairs(int n) {
      final var pairs = new ArrayList<int[]>();
      for (int i = 0; i < n; i++) {
        pairs.add(new int[]{i, (i + 1) % n});
      }
      return pairs;
    }
  },
  /// binary tree in declaration order: node i parents 2i+1 and 2i+2
  TREE {
    @Override
    List<int[]> pairs(int n) {
      final var pairs = new ArrayList<int[]>();
      for (int i = 0; i < n / 2; i++) {
        for (int child : new int[]{2 * i + 1, 2 * i + 2}) {
          if (child < n) {
            pairs.add(new int[]{i, child});
          }
        }
      }
      return pairs;
    }
  };

  /// Index pairs into the declared node list. May contain self pairs and repeats which the builder skips.
  abstract List<int[]> pairs(int n);

  /// Case insensitive parse.
  ///
  /// @throws ConfigurationException if the name is not a topology kind
  public static TopologyKind fromString(String name) {
    if (name == null) {
      throw new ConfigurationException("topology kind is required");
    }
    final var normalized = name.trim().toUpperCase().replace("-", "_");
    try {
      return TopologyKind.valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown topology: " + name + ". Valid options: mesh, star, ring, tree");
    }
  }
}
