// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

import java.util.random.RandomGenerator;

/// The single qubit Pauli operators. These are the depolarising errors applied by noisy links and the corrections
/// applied at the end of teleportation.
public enum Pauli {
  I, X, Y, Z;

  public Amplitudes apply(Amplitudes state) {
    final var a = state.alpha();
    final var b = state.beta();
    return switch (this) {
      case I -> state;
      case X -> new Amplitudes(b, a);
      // Y = [[0, -i], [i, 0]]
      case Y -> new Amplitudes(Complex.I.negate().times(b), Complex.I.times(a));
      case Z -> new Amplitudes(a, b.negate());
    };
  }

  /// @return whether this operator flips the computational basis value.
  public boolean flipsBit() {
    return this == X || this == Y;
  }

  /// @return whether this operator flips the relative phase.
  public boolean flipsPhase() {
    return this == Z || this == Y;
  }

  /// One of X, Y or Z chosen uniformly.
  public static Pauli randomError(RandomGenerator rng) {
    return switch (rng.nextInt(3)) {
      case 0 -> X;
      case 1 -> Y;
      default -> Z;
    };
  }
}
