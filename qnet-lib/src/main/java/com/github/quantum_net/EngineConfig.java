// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

import com.github.quantum_net.log.ExecutionLog;
import com.github.quantum_net.log.InMemoryExecutionLog;
import com.github.quantum_net.protocol.ClusterStateBuilder;
import com.github.quantum_net.routing.PathStrategy;
import lombok.With;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;

/// Immutable engine settings. Start from [#defaults()] and change what you need with the withers.
@With
public record EngineConfig(
    // Reproducibility
    long seed,
    Clock clock,

    // Physics
    double pairFidelity,
    double teleportFidelityBound,
    double purificationStep,
    double purificationCap,

    // Key distribution
    int qkdSampleSize,
    int e91CorrelationSample,

    // Links and channels created without explicit settings
    double defaultLinkDistance,
    double defaultLossRate,
    int defaultChannelCapacity,
    double defaultChannelFidelity,
    double defaultBandwidth,

    // Protocol plumbing
    Duration classicalTimeout,
    PathStrategy pathStrategy,
    @Nullable ClusterStateBuilder clusterStateBuilder,
    ExecutionLog executionLog
) {

  public static EngineConfig defaults() {
    return new EngineConfig(
        0L,                      // seed
        Clock.systemUTC(),       // clock
        0.95,                    // pairFidelity
        0.95,                    // teleportFidelityBound
        0.05,                    // purificationStep
        0.99,                    // purificationCap
        50,                      // qkdSampleSize
        100,                     // e91CorrelationSample
        1.0,                     // defaultLinkDistance
        0.01,                    // defaultLossRate
        64,                      // defaultChannelCapacity
        1.0,                     // defaultChannelFidelity
        1e9,                     // defaultBandwidth
        Duration.ofSeconds(1),   // classicalTimeout
        PathStrategy.SHORTEST,   // pathStrategy
        null,                    // clusterStateBuilder
        new InMemoryExecutionLog()
    );
  }

  /// @throws ConfigurationException naming the first bad setting
  public EngineConfig validate() {
    if (clock == null) throw new ConfigurationException("clock must be specified");
    if (pathStrategy == null) throw new ConfigurationException("pathStrategy must be specified");
    if (executionLog == null) throw new ConfigurationException("executionLog must be specified");
    if (classicalTimeout == null || classicalTimeout.isNegative()) {
      throw new ConfigurationException("classicalTimeout must not be negative: " + classicalTimeout);
    }
    unitInterval("pairFidelity", pairFidelity);
    unitInterval("teleportFidelityBound", teleportFidelityBound);
    unitInterval("purificationStep", purificationStep);
    unitInterval("purificationCap", purificationCap);
    unitInterval("defaultLossRate", defaultLossRate);
    unitInterval("defaultChannelFidelity", defaultChannelFidelity);
    if (qkdSampleSize < 0) throw new ConfigurationException("qkdSampleSize must not be negative: " + qkdSampleSize);
    if (e91CorrelationSample < 1) {
      throw new ConfigurationException("e91CorrelationSample must be at least 1: " + e91CorrelationSample);
    }
    if (defaultLinkDistance < 0) {
      throw new ConfigurationException("defaultLinkDistance must not be negative: " + defaultLinkDistance);
    }
    if (defaultChannelCapacity < 1) {
      throw new ConfigurationException("defaultChannelCapacity must be at least 1: " + defaultChannelCapacity);
    }
    if (!(defaultBandwidth > 0)) throw new ConfigurationException("defaultBandwidth must be positive: " + defaultBandwidth);
    return this;
  }

  private static void unitInterval(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new ConfigurationException(name + " must be in [0,1]: " + value);
    }
  }
}
