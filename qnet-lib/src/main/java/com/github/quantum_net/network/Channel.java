// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.network;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/// A bounded FIFO classical channel carried by a link. The queue is only touched by [ChannelTransport] while holding
/// the channel's lock; receivers wait on the channel's condition rather than polling.
public final class Channel {
  private final String id;
  private final String linkId;
  private final int capacity;
  private final double fidelity;
  private final double bandwidth;

  final ReentrantLock lock = new ReentrantLock(true);
  final Condition arrived = lock.newCondition();
  final Deque<Envelope> queue = new ArrayDeque<>();
  int waiting = 0;

  public Channel(String id, String linkId, int capacity, double fidelity, double bandwidth) {
    if (capacity < 1) {
      throw new IllegalArgumentException("channel capacity must be at least 1: " + capacity);
    }
    this.id = id;
    this.linkId = linkId;
    this.capacity = capacity;
    this.fidelity = fidelity;
    this.bandwidth = bandwidth;
  }

  public String id() {
    return id;
  }

  public String linkId() {
    return linkId;
  }

  public int capacity() {
    return capacity;
  }

  public double fidelity() {
    return fidelity;
  }

  public double bandwidth() {
    return bandwidth;
  }

  public int depth() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  /// @return true while a message is queued or a receiver is waiting.
  public boolean busy() {
    lock.lock();
    try {
      return !queue.isEmpty() || waiting > 0;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "Channel[" + id + ",capacity=" + capacity + "]";
  }
}
