// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.log;

import java.util.List;
import java.util.Optional;

/// Where the engine records a summary of each protocol run.
///
/// Appends happen from concurrent protocol runs so implementations must be thread safe. Durable implementations may
/// buffer writes until [#sync()] is called; the engine calls it after every append.
public interface ExecutionLog {

  void append(ExecutionRecord record);

  Optional<ExecutionRecord> read(long sequence);

  /// @return every record in sequence order
  List<ExecutionRecord> records();

  /// Make appended records durable. A no-op for memory backed logs.
  void sync();

  /// @return the highest sequence appended or 0 when empty
  long highestSequence();
}
