// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

/// A protocol could not enqueue a classical message because the channel was full.
public class ChannelCapacityException extends QuantumNetException {
  public ChannelCapacityException(String message) {
    super(ErrorKind.CAPACITY_EXCEEDED, message);
  }
}
