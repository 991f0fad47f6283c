// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.network;

/// The result of a non blocking send.
public sealed interface SendOutcome {
  record Accepted(int queueDepth) implements SendOutcome {
  }

  record CapacityExceeded(int capacity) implements SendOutcome {
  }
}
