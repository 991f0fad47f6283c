// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

/// A network specification, engine configuration or protocol argument is invalid.
public class ConfigurationException extends QuantumNetException {
  public ConfigurationException(String message) {
    super(ErrorKind.CONFIGURATION, message);
  }
}
