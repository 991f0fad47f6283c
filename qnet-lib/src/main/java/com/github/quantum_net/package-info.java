// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// A simulation engine for quantum network protocols.
///
/// Build an [com.github.quantum_net.EngineConfig], describe the network with a
/// [com.github.quantum_net.topology.NetworkSpec] and create a [com.github.quantum_net.QuantumNetEngine]. Protocol
/// invocations are then executed on the caller's thread or submitted to the engine's executor and each returns an
/// immutable result record.
///
/// Errors:
/// - `ConfigurationException`: an invalid network description, setting or argument
/// - `UnknownReferenceException`: an unknown node, qubit, pair, channel or route
/// - `ResourceExhaustedException`: a node has no room for another qubit
/// - `QubitStateException`: a consumed qubit or pair was used
/// - `ChannelCapacityException`: a protocol found a classical channel full
/// - `ReceiveTimeoutException`: a protocol's classical message did not arrive in time
///
/// The engine returns each of these as a failed result. Key distribution that detects too many errors is an aborted
/// result, which is an expected outcome and not a failure.
package com.github.quantum_net;
