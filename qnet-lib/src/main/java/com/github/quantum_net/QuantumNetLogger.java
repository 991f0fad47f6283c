// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. All classes in the library log through this single logger so that a host application can silence or
/// raise the engine's output with one setting.
public final class QuantumNetLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.quantum_net");

  private QuantumNetLogger() {
  }
}
