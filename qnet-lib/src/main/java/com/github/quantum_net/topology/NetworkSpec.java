// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.topology;

import com.github.quantum_net.resource.QuantumMemory;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/// A declarative description of a network. Kinds are strings so that configuration read from outside is validated
/// by the builder which reports unknown values as configuration errors.
///
/// @param topology one of mesh, star, ring or tree
/// @param nodes    in declaration order which the topology algorithm indexes into
public record NetworkSpec(String name, String topology, List<NodeSpec> nodes, List<LinkSpec> links) {
  public NetworkSpec {
    nodes = List.copyOf(nodes);
    links = List.copyOf(links);
  }

  public NetworkSpec(String name, String topology, List<NodeSpec> nodes) {
    this(name, topology, nodes, List.of());
  }

  /// @param qubitCount size of the register, each slot starting in |0>
  public record NodeSpec(String id,
                         String kind,
                         int qubitCount,
                         @Nullable QuantumMemory memory,
                         @Nullable Position position) {

    public static NodeSpec of(String id, String kind, int qubitCount) {
      return new NodeSpec(id, kind, qubitCount, null, null);
    }

    public NodeSpec withMemory(QuantumMemory memory) {
      return new NodeSpec(id, kind, qubitCount, memory, position);
    }

    public NodeSpec at(Position position) {
      return new NodeSpec(id, kind, qubitCount, memory, position);
    }
  }

  /// @param channels may be empty in which case a default classical channel is created
  public record LinkSpec(String source, String target, double distance, double lossRate, List<ChannelSpec> channels) {
    public LinkSpec {
      channels = List.copyOf(channels);
    }

    public static LinkSpec of(String source, String target, double distance, double lossRate) {
      return new LinkSpec(source, target, distance, lossRate, List.of());
    }
  }

  /// @param bandwidth bits per second
  public record ChannelSpec(String id, int capacity, double fidelity, double bandwidth) {
  }
}
