// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.network;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/// A receive running in the background. Cancelling wakes the waiting receiver which then completes with
/// [ReceiveOutcome.Cancelled]; messages already queued are left where they are.
public final class PendingReceive {
  private final Channel channel;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final CompletableFuture<ReceiveOutcome> outcome = new CompletableFuture<>();
  /// guarded by the channel lock
  private boolean settled;

  PendingReceive(Channel channel) {
    this.channel = channel;
  }

  public CompletableFuture<ReceiveOutcome> outcome() {
    return outcome;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /// @return false if the receive had already taken a message, timed out or failed
  public boolean cancel() {
    channel.lock.lock();
    try {
      if (settled || outcome.isDone()) {
        return false;
      }
      cancelled.set(true);
      channel.arrived.signalAll();
      return true;
    } finally {
      channel.lock.unlock();
    }
  }

  /// Called with the channel lock held once the receive has an outcome other than cancellation.
  void settle() {
    settled = true;
  }

  void complete(ReceiveOutcome result) {
    outcome.complete(result);
  }

  void fail(Throwable t) {
    outcome.completeExceptionally(t);
  }
}
