// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

/// Thrown when a node, qubit, pair, link, channel or route id is not known to the network.
public class UnknownReferenceException extends QuantumNetException {
  public UnknownReferenceException(String message) {
    super(ErrorKind.REFERENCE, message);
  }
}
