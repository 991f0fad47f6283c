// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.log;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.util.List;
import java.util.Optional;

/// An execution log kept in an H2 MVStore map keyed by sequence number. Pass `MVStore.open(null)` for an in memory
/// store or a file name for one that survives restarts.
public class MVStoreExecutionLog implements ExecutionLog {
  private final MVStore store;
  private final MVMap<Long, ExecutionRecord> records;

  public MVStoreExecutionLog(MVStore store) {
    this.store = store;
    this.records = store.openMap("com.github.quantum_net.log#records");
  }

  @Override
  public void append(ExecutionRecord record) {
    records.put(record.sequence(), record);
  }

  @Override
  public Optional<ExecutionRecord> read(long sequence) {
    return Optional.ofNullable(records.get(sequence));
  }

  @Override
  public List<ExecutionRecord> records() {
    return List.copyOf(records.values());
  }

  @Override
  public void sync() {
    store.commit();
  }

  @Override
  public long highestSequence() {
    return records.isEmpty() ? 0 : records.lastKey();
  }
}
