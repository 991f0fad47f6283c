// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.network;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/// A classical message in a channel queue.
///
/// @param correlation the protocol run that sent it, so that concurrent runs sharing a channel only take their own
///                    messages; null for raw sends
public record Envelope(String payload, String destination, Instant timestamp, @Nullable String correlation) {
}
