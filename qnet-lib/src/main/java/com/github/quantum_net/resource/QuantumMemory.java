// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import java.time.Duration;

/// Storage for qubits beyond a node's register.
///
/// @param capacity      how many extra qubits the node can hold
/// @param coherenceTime how long stored qubits stay usable; reported only, decoherence is not simulated
public record QuantumMemory(int capacity, Duration coherenceTime) {
  public QuantumMemory {
    if (capacity < 0) {
      throw new IllegalArgumentException("memory capacity must not be negative: " + capacity);
    }
    if (coherenceTime.isNegative()) {
      throw new IllegalArgumentException("coherence time must not be negative: " + coherenceTime);
    }
  }
}
