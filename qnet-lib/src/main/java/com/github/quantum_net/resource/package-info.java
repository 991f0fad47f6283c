// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Qubits, entangled pairs and the arenas that own them.
package com.github.quantum_net.resource;
