// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.routing;

import com.github.quantum_net.ConfigurationException;
import com.github.quantum_net.UnknownReferenceException;
import com.github.quantum_net.topology.Link;
import com.github.quantum_net.topology.Network;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// Finds routes over a [Network]. Named routes defined by the caller take precedence over computed ones between the
/// same endpoints. Ties are broken by the order in which links were created so results are deterministic.
public final class Router {
  private final Network network;
  private final Map<String, Route> namedRoutes = new ConcurrentHashMap<>();
  private volatile PathStrategy strategy;

  public Router(Network network, PathStrategy strategy) {
    this.network = network;
    this.strategy = strategy;
  }

  public PathStrategy strategy() {
    return strategy;
  }

  public void strategy(PathStrategy strategy) {
    LOGGER.info(() -> "path strategy " + this.strategy + " -> " + strategy);
    this.strategy = strategy;
  }

  /// Records a path under a name. Each consecutive pair of nodes must be linked.
  ///
  /// @throws UnknownReferenceException if a node does not exist or two consecutive nodes are not linked
  public Route defineRoute(String name, List<String> path) {
    if (path.size() < 2) {
      throw new ConfigurationException("route " + name + " needs at least two nodes: " + path);
    }
    final var links = new ArrayList<Link>();
    for (int i = 0; i + 1 < path.size(); i++) {
      network.node(path.get(i));
      final var from = path.get(i);
      final var to = path.get(i + 1);
      network.node(to);
      links.add(network.linkBetween(from, to)
          .orElseThrow(() -> new UnknownReferenceException("route " + name + ": no link between " + from + " and " + to)));
    }
    final var route = new Route(path, links);
    namedRoutes.put(name, route);
    return route;
  }

  /// @throws UnknownReferenceException if no route has the name
  public Route namedRoute(String name) {
    final var route = namedRoutes.get(name);
    if (route == null) {
      throw new UnknownReferenceException("unknown route: " + name);
    }
    return route;
  }

  public Route route(String from, String to) {
    return route(from, to, strategy);
  }

  /// @throws UnknownReferenceException if a node does not exist or the nodes are not connected
  public Route route(String from, String to, PathStrategy strategy) {
    network.node(from);
    network.node(to);
    if (from.equals(to)) {
      return new Route(List.of(from), List.of());
    }
    final var named = named(from, to);
    if (named.isPresent()) {
      return named.get();
    }
    final var route = strategy == PathStrategy.SHORTEST ? breadthFirst(from, to) : cheapest(from, to, strategy);
    LOGGER.finer(() -> strategy + " route " + from + "->" + to + " " + route.nodes());
    return route;
  }

  private Optional<Route> named(String from, String to) {
    for (var route : namedRoutes.values()) {
      if (route.source().equals(from) && route.destination().equals(to)) {
        return Optional.of(route);
      }
      if (route.source().equals(to) && route.destination().equals(from)) {
        return Optional.of(route.reversed());
      }
    }
    return Optional.empty();
  }

  private Route breadthFirst(String from, String to) {
    final Map<String, String> parent = new HashMap<>();
    final var queue = new ArrayDeque<String>();
    parent.put(from, from);
    queue.add(from);
    while (!queue.isEmpty()) {
      final var current = queue.poll();
      if (current.equals(to)) {
        return unwind(parent, from, to);
      }
      for (var next : network.node(current).neighbourList()) {
        if (!parent.containsKey(next)) {
          parent.put(next, current);
          queue.add(next);
        }
      }
    }
    throw new UnknownReferenceException("no route from " + from + " to " + to);
  }

  private Route cheapest(String from, String to, PathStrategy strategy) {
    record Entry(String node, double cost) {
    }
    final Map<String, Double> best = new HashMap<>();
    final Map<String, String> parent = new HashMap<>();
    final var queue = new PriorityQueue<Entry>((a, b) -> Double.compare(a.cost(), b.cost()));
    best.put(from, 0.0);
    parent.put(from, from);
    queue.add(new Entry(from, 0.0));
    while (!queue.isEmpty()) {
      final var entry = queue.poll();
      if (entry.cost() > best.getOrDefault(entry.node(), Double.POSITIVE_INFINITY)) {
        continue;
      }
      if (entry.node().equals(to)) {
        return unwind(parent, from, to);
      }
      for (var next : network.node(entry.node()).neighbourList()) {
        final var link = network.linkBetween(entry.node(), next).orElseThrow();
        final double cost = entry.cost() + strategy.cost(link);
        if (Double.isFinite(cost) && cost < best.getOrDefault(next, Double.POSITIVE_INFINITY)) {
          best.put(next, cost);
          parent.put(next, entry.node());
          queue.add(new Entry(next, cost));
        }
      }
    }
    throw new UnknownReferenceException("no route from " + from + " to " + to);
  }

  private Route unwind(Map<String, String> parent, String from, String to) {
    final var nodes = new ArrayList<String>();
    for (var at = to; ; at = parent.get(at)) {
      nodes.add(at);
      if (at.equals(from)) break;
    }
    Collections.reverse(nodes);
    final var links = new ArrayList<Link>();
    for (int i = 0; i + 1 < nodes.size(); i++) {
      links.add(network.linkBetween(nodes.get(i), nodes.get(i + 1)).orElseThrow());
    }
    return new Route(nodes, links);
  }
}
