// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.log;

import com.github.quantum_net.ErrorKind;
import com.github.quantum_net.protocol.Status;
import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class ExecutionLogTests {

  private static ExecutionRecord record(long sequence, Status status) {
    return new ExecutionRecord(sequence, "bb84", status,
        status == Status.FAILED ? ErrorKind.REFERENCE : null, "run " + sequence, Instant.ofEpochSecond(sequence));
  }

  @Test
  void memoryLogKeepsSequenceOrder() {
    final var log = new InMemoryExecutionLog();
    assertThat(log.highestSequence()).isZero();
    log.append(record(3, Status.COMPLETED));
    log.append(record(1, Status.FAILED));
    log.append(record(2, Status.ABORTED));
    assertThat(log.records()).extracting(ExecutionRecord::sequence).containsExactly(1L, 2L, 3L);
    assertThat(log.highestSequence()).isEqualTo(3);
    assertThat(log.read(1)).get().extracting(ExecutionRecord::errorKind).isEqualTo(ErrorKind.REFERENCE);
    assertThat(log.read(9)).isEmpty();
  }

  @Test
  void mvstoreLogInMemory() {
    try (var store = MVStore.open(null)) {
      final var log = new MVStoreExecutionLog(store);
      log.append(record(1, Status.COMPLETED));
      log.append(record(2, Status.FAILED));
      log.sync();
      assertThat(log.records()).hasSize(2);
      assertThat(log.read(2)).contains(record(2, Status.FAILED));
      assertThat(log.highestSequence()).isEqualTo(2);
    }
  }

  @Test
  void mvstoreLogSurvivesReopen(@TempDir Path dir) {
    final var file = dir.resolve("execution.mv").toString();
    try (var store = MVStore.open(file)) {
      final var log = new MVStoreExecutionLog(store);
      log.append(record(1, Status.COMPLETED));
      log.append(record(2, Status.ABORTED));
      log.sync();
    }
    try (var store = MVStore.open(file)) {
      final var log = new MVStoreExecutionLog(store);
      assertThat(log.highestSequence()).isEqualTo(2);
      assertThat(log.read(2)).get().extracting(ExecutionRecord::status).isEqualTo(Status.ABORTED);
    }
  }
}
