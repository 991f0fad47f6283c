// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.routing;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.topology.Link;

/// How [Router] picks between candidate paths.
public enum PathStrategy {
  /// fewest hops
  SHORTEST {
    @Override
    double cost(Link link) {
      return 1.0;
    }
  },
  /// maximises the product of per link `bestChannelFidelity * (1 - lossRate)`
  HIGHEST_FIDELITY {
    @Override
    double cost(Link link) {
      final double survival = link.bestChannelFidelity() * (1.0 - link.lossRate());
      return survival <= 0.0 ? Double.POSITIVE_INFINITY : -Math.log(survival);
    }
  },
  /// minimises the sum of `distance / bandwidth`
  LOWEST_LATENCY {
    @Override
    double cost(Link link) {
      final double bandwidth = link.bestBandwidth();
      return bandwidth <= 0.0 ? Double.POSITIVE_INFINITY : link.distance() / bandwidth;
    }
  };

  abstract double cost(Link link);

  public static PathStrategy fromString(String name) {
    if (name == null) {
      return SHORTEST;
    }
    try {
      return PathStrategy.valueOf(name.trim().toUpperCase().replace("-", "_"));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown path strategy: " + name
          + ". Valid options: shortest, highest_fidelity, lowest_latency");
    }
  }
}
