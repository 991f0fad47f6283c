// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import java.util.random.RandomGenerator;

/// Measurement reference frames. Z is the computational basis and X is the Hadamard basis.
public enum Basis {
  Z, X;

  public static Basis random(RandomGenerator rng) {
    return rng.nextBoolean() ? X : Z;
  }
}
