// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.topology;

import com.github.quantum_net.QubitStateException;
import com.github.quantum_net.network.Channel;

import java.util.List;

/// An undirected connection between two nodes carrying one or more classical channels.
///
/// @param id       `source-target`
/// @param lossRate probability that a qubit crossing the link suffers a Pauli error
public record Link(String id, String source, String target, double distance, double lossRate, List<Channel> channels) {
  public Link {
    channels = List.copyOf(channels);
  }

  public boolean connects(String a, String b) {
    return (source.equals(a) && target.equals(b)) || (source.equals(b) && target.equals(a));
  }

  public String otherEnd(String nodeId) {
    if (source.equals(nodeId)) return target;
    if (target.equals(nodeId)) return source;
    throw new QubitStateException("link " + id + " does not touch " + nodeId);
  }

  /// The channel used for protocol messages.
  public Channel classicalChannel() {
    return channels.get(0);
  }

  public double bestChannelFidelity() {
    return channels.stream().mapToDouble(Channel::fidelity).max().orElse(0.0);
  }

  public double bestBandwidth() {
    return channels.stream().mapToDouble(Channel::bandwidth).max().orElse(0.0);
  }
}
