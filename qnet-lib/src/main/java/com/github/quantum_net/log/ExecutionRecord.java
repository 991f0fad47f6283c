// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.log;

import com.github.quantum_net.ErrorKind;
import com.github.quantum_net.protocol.Status;
import org.jetbrains.annotations.Nullable;

import java.io.Serializable;
import java.time.Instant;

/// A one line summary of a finished protocol run. Results themselves are returned to the caller and not retained.
///
/// @param sequence  assigned by the engine, strictly increasing
/// @param errorKind null when the run completed
public record ExecutionRecord(long sequence,
                              String protocol,
                              Status status,
                              @Nullable ErrorKind errorKind,
                              String summary,
                              Instant instant) implements Serializable {
}
