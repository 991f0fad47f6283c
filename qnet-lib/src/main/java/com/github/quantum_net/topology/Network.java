// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.topology;

import com.github.quantum_net.UnknownReferenceException;
import com.github.quantum_net.network.Channel;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// The materialised topology. Built once by [TopologyBuilder] and not structurally modified afterwards so lookups
/// need no locking.
public final class Network {
  private final String name;
  private final TopologyKind kind;
  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private final Map<String, Link> links = new LinkedHashMap<>();
  private final Map<String, Channel> channels = new LinkedHashMap<>();

  Network(String name, TopologyKind kind) {
    this.name = name;
    this.kind = kind;
  }

  public String name() {
    return name;
  }

  public TopologyKind kind() {
    return kind;
  }

  /// @throws UnknownReferenceException if there is no such node
  public Node node(String id) {
    final var node = nodes.get(id);
    if (node == null) {
      throw new UnknownReferenceException("unknown node: " + id);
    }
    return node;
  }

  public boolean hasNode(String id) {
    return nodes.containsKey(id);
  }

  /// @throws UnknownReferenceException if there is no such link
  public Link link(String id) {
    final var link = links.get(id);
    if (link == null) {
      throw new UnknownReferenceException("unknown link: " + id);
    }
    return link;
  }

  /// The link joining two nodes in either orientation.
  public Optional<Link> linkBetween(String a, String b) {
    return links.values().stream().filter(l -> l.connects(a, b)).findFirst();
  }

  /// @throws UnknownReferenceException if there is no such channel
  public Channel channel(String id) {
    final var channel = channels.get(id);
    if (channel == null) {
      throw new UnknownReferenceException("unknown channel: " + id);
    }
    return channel;
  }

  public Collection<Node> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public List<String> nodeIds() {
    return List.copyOf(nodes.keySet());
  }

  public Collection<Link> links() {
    return Collections.unmodifiableCollection(links.values());
  }

  public Collection<Channel> channels() {
    return Collections.unmodifiableCollection(channels.values());
  }

  void add(Node node) {
    nodes.put(node.id(), node);
  }

  void add(Link link) {
    links.put(link.id(), link);
    link.channels().forEach(c -> channels.put(c.id(), c));
    nodes.get(link.source()).addNeighbour(link.target());
    nodes.get(link.target()).addNeighbour(link.source());
  }

  boolean hasChannel(String id) {
    return channels.containsKey(id);
  }
}
