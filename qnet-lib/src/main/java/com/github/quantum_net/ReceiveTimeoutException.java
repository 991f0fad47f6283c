// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

/// A protocol step waited for a classical message longer than its deadline.
public class ReceiveTimeoutException extends QuantumNetException {
  public ReceiveTimeoutException(String message) {
    super(ErrorKind.TIMED_OUT, message);
  }
}
