// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

import com.github.quantum_net.log.ExecutionLog;
import com.github.quantum_net.log.ExecutionRecord;
import com.github.quantum_net.network.ChannelTransport;
import com.github.quantum_net.protocol.ProtocolEngine;
import com.github.quantum_net.protocol.ProtocolInvocation;
import com.github.quantum_net.protocol.ProtocolResult;
import com.github.quantum_net.protocol.Status;
import com.github.quantum_net.resource.QuantumResources;
import com.github.quantum_net.routing.Router;
import com.github.quantum_net.topology.Network;
import com.github.quantum_net.topology.NetworkSpec;
import com.github.quantum_net.topology.TopologyBuilder;
import org.jetbrains.annotations.TestOnly;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

import static com.github.quantum_net.QuantumNetLogger.LOGGER;

/// One simulated quantum network and everything needed to run protocols on it. Several engines can live in one
/// process; they share nothing.
///
/// Each run gets its own generator split from the engine's seeded generator at the moment the run is accepted, so a
/// sequence of runs issued one after another is reproducible for a given seed. Failures of the expected kinds come
/// back as [ProtocolResult.Failed]; anything else is a bug and propagates.
public final class QuantumNetEngine implements AutoCloseable {
  private final EngineConfig config;
  private final Network network;
  private final QuantumResources resources;
  private final ChannelTransport transport;
  private final Router router;
  private final ProtocolEngine protocols;
  private final ExecutionLog executionLog;
  private final RandomGenerator.SplittableGenerator generator;
  private final ExecutorService executor;
  private final AtomicLong threads = new AtomicLong();
  private final AtomicLong sequence;

  private QuantumNetEngine(EngineConfig config, Network network, QuantumResources resources) {
    this.config = config;
    this.network = network;
    this.resources = resources;
    this.transport = new ChannelTransport(config.clock());
    this.router = new Router(network, config.pathStrategy());
    this.protocols = new ProtocolEngine(network, resources, transport, router, config);
    this.executionLog = config.executionLog();
    this.sequence = new AtomicLong(executionLog.highestSequence());
    this.generator = RandomGeneratorFactory.<RandomGenerator.SplittableGenerator>of("L64X128MixRandom")
        .create(config.seed());
    this.executor = Executors.newCachedThreadPool(r -> {
      final var thread = new Thread(r, "qnet-" + network.name() + "-" + threads.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /// Validates the configuration and builds the network.
  ///
  /// @throws ConfigurationException if either is invalid
  public static QuantumNetEngine create(EngineConfig config, NetworkSpec spec) {
    config.validate();
    final var resources = new QuantumResources(config.clock(), config.pairFidelity());
    final var network = new TopologyBuilder(resources, config).build(spec);
    LOGGER.info(() -> "created engine for " + network.kind() + " network " + network.name()
        + " nodes=" + network.nodes().size() + " links=" + network.links().size() + " seed=" + config.seed());
    return new QuantumNetEngine(config, network, resources);
  }

  /// Runs the protocol on the calling thread.
  public ProtocolResult execute(ProtocolInvocation invocation) {
    return run(invocation, nextGenerator());
  }

  /// Runs the protocol on the engine's executor.
  public CompletableFuture<ProtocolResult> submit(ProtocolInvocation invocation) {
    final var rng = nextGenerator();
    return CompletableFuture.supplyAsync(() -> run(invocation, rng), executor);
  }

  private synchronized RandomGenerator nextGenerator() {
    return generator.split();
  }

  private ProtocolResult run(ProtocolInvocation invocation, RandomGenerator rng) {
    final long seq = sequence.incrementAndGet();
    final var correlation = invocation.protocol() + "-" + seq;
    LOGGER.fine(() -> "starting " + correlation + " " + invocation);
    ProtocolResult result;
    try {
      result = protocols.run(invocation, rng, correlation);
    } catch (QuantumNetException e) {
      LOGGER.log(Level.WARNING, correlation + " failed with " + e.errorKind() + ": " + e.getMessage());
      result = new ProtocolResult.Failed(invocation.protocol(), e.errorKind(), e.getMessage());
    }
    final var finished = result;
    if (finished.status() == Status.ABORTED) {
      LOGGER.warning(() -> correlation + " " + finished.message());
    } else if (finished.status() == Status.COMPLETED) {
      LOGGER.info(() -> correlation + " " + finished.message());
    }
    executionLog.append(new ExecutionRecord(seq, finished.protocol(), finished.status(), finished.errorKind(),
        finished.message(), config.clock().instant()));
    executionLog.sync();
    return finished;
  }

  public EngineConfig config() {
    return config;
  }

  public Network network() {
    return network;
  }

  public QuantumResources resources() {
    return resources;
  }

  public ChannelTransport transport() {
    return transport;
  }

  public Router router() {
    return router;
  }

  public ExecutionLog executionLog() {
    return executionLog;
  }

  @TestOnly
  ExecutorService executor() {
    return executor;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(config.classicalTimeout().toMillis() + 1000, TimeUnit.MILLISECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    LOGGER.info(() -> "closed engine for network " + network.name());
  }
}
