// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.routing;

import com.github.quantum_net.topology.Link;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// A path through the network. `links.get(i)` joins `nodes.get(i)` and `nodes.get(i + 1)`.
public record Route(List<String> nodes, List<Link> links) {
  public Route {
    nodes = List.copyOf(nodes);
    links = List.copyOf(links);
    if (nodes.isEmpty() || links.size() != nodes.size() - 1) {
      throw new IllegalArgumentException("route needs n nodes and n-1 links: " + nodes + " " + links.size());
    }
  }

  public int hops() {
    return links.size();
  }

  public String source() {
    return nodes.get(0);
  }

  public String destination() {
    return nodes.get(nodes.size() - 1);
  }

  public Route reversed() {
    final var n = new ArrayList<>(nodes);
    final var l = new ArrayList<>(links);
    Collections.reverse(n);
    Collections.reverse(l);
    return new Route(n, l);
  }
}
