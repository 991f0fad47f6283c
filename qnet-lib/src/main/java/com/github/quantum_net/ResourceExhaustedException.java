// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

/// A node cannot host another qubit because its register and memory are full.
public class ResourceExhaustedException extends QuantumNetException {
  public ResourceExhaustedException(String message) {
    super(ErrorKind.RESOURCE, message);
  }
}
