// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

/// Base of the engine's unchecked exceptions. The resource model and the transport throw these; the engine turns
/// each one into a failed result record carrying the [ErrorKind].
public abstract class QuantumNetException extends RuntimeException {
  private final ErrorKind errorKind;

  protected QuantumNetException(ErrorKind errorKind, String message) {
    super(message);
    this.errorKind = errorKind;
  }

  protected QuantumNetException(ErrorKind errorKind, String message, Throwable cause) {
    super(message, cause);
    this.errorKind = errorKind;
  }

  public ErrorKind errorKind() {
    return errorKind;
  }
}
