// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.network;

/// The result of a receive.
public sealed interface ReceiveOutcome {
  record Received(Envelope envelope) implements ReceiveOutcome {
  }

  record TimedOut() implements ReceiveOutcome {
  }

  record Cancelled() implements ReceiveOutcome {
  }

  ReceiveOutcome TIMED_OUT = new TimedOut();
  ReceiveOutcome CANCELLED = new Cancelled();
}
