// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.protocol;

/// The stages of a key distribution run in the order they are entered. A result reports the last one reached.
public enum QkdPhase {
  PREPARING, TRANSMITTING, MEASURING, SIFTING, ERROR_ESTIMATION, KEY_ACCEPTED, ABORTED
}
