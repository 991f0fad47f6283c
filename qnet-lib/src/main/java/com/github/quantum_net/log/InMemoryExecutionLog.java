// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.log;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryExecutionLog implements ExecutionLog {
  private final ConcurrentSkipListMap<Long, ExecutionRecord> records = new ConcurrentSkipListMap<>();

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
  }

  @Override
  public long highestSequence() {
    return records.isEmpty() ? 0 : records.lastKey();
  }
}
