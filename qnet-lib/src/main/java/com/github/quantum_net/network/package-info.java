// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Classical channels and the transport that moves messages through them.
///
/// Design characteristics:
/// 1. Sends never block; a full queue is an outcome not an exception
/// 2. Receives wait on a per channel condition with a timeout and can be cancelled
/// 3. Messages carry a correlation id so concurrent protocol runs sharing a channel stay apart
package com.github.quantum_net.network;
