// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

/// The qubit has already been measured, consumed or released.
public class QubitStateException extends QuantumNetException {
  public QubitStateException(String message) {
    super(ErrorKind.STATE, message);
  }
}
