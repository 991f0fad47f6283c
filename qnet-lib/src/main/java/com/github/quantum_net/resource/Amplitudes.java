// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

/// The two entry amplitude vector `alpha|0> + beta|1>` of a single qubit. Instances are immutable and kept
/// normalised by the operations that create them.
public record Amplitudes(Complex alpha, Complex beta) {
  private static final double ROOT_HALF = Math.sqrt(0.5);
  private static final double TOLERANCE = 1e-9;

  public static final Amplitudes ZERO = new Amplitudes(Complex.ONE, Complex.ZERO);
  public static final Amplitudes ONE = new Amplitudes(Complex.ZERO, Complex.ONE);
  public static final Amplitudes PLUS = new Amplitudes(Complex.real(ROOT_HALF), Complex.real(ROOT_HALF));
  public static final Amplitudes MINUS = new Amplitudes(Complex.real(ROOT_HALF), Complex.real(-ROOT_HALF));

  public Amplitudes {
    final var norm = alpha.abs2() + beta.abs2();
    if (Math.abs(norm - 1.0) > 1e-6) {
      throw new IllegalArgumentException("amplitudes are not normalised: |alpha|^2+|beta|^2=" + norm);
    }
  }

  /// The eigenstate of the basis for the given classical bit: |0>,|1> for Z and |+>,|-> for X.
  public static Amplitudes basisState(Basis basis, int bit) {
    return switch (basis) {
      case Z -> bit == 0 ? ZERO : ONE;
      case X -> bit == 0 ? PLUS : MINUS;
    };
  }

  /// Rotates the vector into the given basis. For X this applies the Hadamard transform so that the first entry is
  /// the amplitude of |+> and the second that of |->.
  public Amplitudes inBasis(Basis basis) {
    return switch (basis) {
      case Z -> this;
      case X -> new Amplitudes(alpha.plus(beta).scale(ROOT_HALF), alpha.minus(beta).scale(ROOT_HALF));
    };
  }

  /// @return the probability of reading `0` when measuring in the given basis.
  public double probabilityOfZero(Basis basis) {
    final var p = inBasis(basis).alpha().abs2();
    return Math.min(1.0, Math.max(0.0, p));
  }

  /// Equality up to a global phase which is not observable.
  public boolean equivalent(Amplitudes other) {
    final var overlap = alpha.times(conjugate(other.alpha)).plus(beta.times(conjugate(other.beta)));
    return Math.abs(overlap.abs2() - 1.0) <= TOLERANCE;
  }

  private static Complex conjugate(Complex c) {
    return new Complex(c.re(), -c.im());
  }
}
