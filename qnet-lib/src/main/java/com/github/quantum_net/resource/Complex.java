// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

/// An immutable complex number. Only the handful of operations the single qubit model needs are provided.
public record Complex(double re, double im) {
  public static final Complex ZERO = new Complex(0.0, 0.0);
  public static final Complex ONE = new Complex(1.0, 0.0);
  public static final Complex I = new Complex(0.0, 1.0);

  public static Complex real(double re) {
    return new Complex(re, 0.0);
  }

  public Complex plus(Complex other) {
    return new Complex(re + other.re, im + other.im);
  }

  public Complex minus(Complex other) {
    return new Complex(re - other.re, im - other.im);
  }

  public Complex times(Complex other) {
    return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
  }

  public Complex scale(double factor) {
    return new Complex(re * factor, im * factor);
  }

  public Complex negate() {
    return new Complex(-re, -im);
  }

  /// @return the squared modulus which is the Born rule probability weight of an amplitude.
  public double abs2() {
    return re * re + im * im;
  }

  public boolean approximately(Complex other, double tolerance) {
    return Math.abs(re - other.re) <= tolerance && Math.abs(im - other.im) <= tolerance;
  }
}
