// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import com.github.quantum_net.QubitStateException;
import com.github.quantum_net.UnknownReferenceException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/// A dense, generational store of values addressed by [Handle]. Values are also indexed by a unique string id so that
/// callers speaking in ids (protocol invocations) and callers holding handles (nodes, pairs) see the same entries.
///
/// Concurrent protocol runs allocate and release through this class so every method is guarded by a read write lock.
/// The values themselves are not protected here; each protocol run only touches the values it allocated or claimed.
public final class Arena<T> {
  private final String kind;
  private final List<T> values = new ArrayList<>();
  private final List<String> ids = new ArrayList<>();
  private final List<Integer> generations = new ArrayList<>();
  private final Deque<Integer> free = new ArrayDeque<>();
  private final Map<String, Handle> byId = new HashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  /// @param kind what is stored, used in error messages e.g. "qubit"
  public Arena(String kind) {
    this.kind = kind;
  }

  /// Stores a new value built from its handle. The id must not be in use.
  public T allocate(String id, Function<Handle, T> factory) {
    lock.writeLock().lock();
    try {
      if (byId.containsKey(id)) {
        throw new IllegalStateException(kind + " id already allocated: " + id);
      }
      final Integer reused = free.pollFirst();
      final int index;
      if (reused != null) {
        index = reused;
      } else {
        index = values.size();
        values.add(null);
        ids.add(null);
        generations.add(0);
      }
      final var handle = new Handle(index, generations.get(index));
      final var value = factory.apply(handle);
      values.set(index, value);
      ids.set(index, id);
      byId.put(id, handle);
      return value;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /// @throws QubitStateException if the handle is stale because its slot was released.
  public T get(Handle handle) {
    lock.readLock().lock();
    try {
      if (handle.index() >= values.size()
          || generations.get(handle.index()) != handle.generation()
          || values.get(handle.index()) == null) {
        throw new QubitStateException(kind + " handle " + handle + " has been released");
      }
      return values.get(handle.index());
    } finally {
      lock.readLock().unlock();
    }
  }

  /// @return the value for a live handle, empty if the handle is stale.
  public Optional<T> find(Handle handle) {
    lock.readLock().lock();
    try {
      if (handle.index() >= values.size() || generations.get(handle.index()) != handle.generation()) {
        return Optional.empty();
      }
      return Optional.ofNullable(values.get(handle.index()));
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<Handle> find(String id) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(byId.get(id));
    } finally {
      lock.readLock().unlock();
    }
  }

  /// @throws UnknownReferenceException if there is no value with the id.
  public T byId(String id) {
    return get(find(id).orElseThrow(() -> new UnknownReferenceException("unknown " + kind + ": " + id)));
  }

  /// Swaps in a new immutable value for a live handle, e.g. a pair whose fidelity changed.
  public void replace(Handle handle, T value) {
    lock.writeLock().lock();
    try {
      if (handle.index() >= values.size()
          || generations.get(handle.index()) != handle.generation()
          || values.get(handle.index()) == null) {
        throw new QubitStateException(kind + " handle " + handle + " has been released");
      }
      values.set(handle.index(), value);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /// Frees the slot and its id for reuse. Releasing a stale handle is a no-op.
  public void release(Handle handle) {
    lock.writeLock().lock();
    try {
      final int index = handle.index();
      if (index >= values.size() || generations.get(index) != handle.generation() || values.get(index) == null) {
        return;
      }
      byId.remove(ids.get(index));
      values.set(index, null);
      ids.set(index, null);
      generations.set(index, handle.generation() + 1);
      free.addLast(index);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /// @return the number of live values.
  public int size() {
    lock.readLock().lock();
    try {
      return byId.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /// @return a snapshot of the live values in slot order.
  public List<T> values() {
    lock.readLock().lock();
    try {
      return values.stream().filter(Objects::nonNull).toList();
    } finally {
      lock.readLock().unlock();
    }
  }
}
