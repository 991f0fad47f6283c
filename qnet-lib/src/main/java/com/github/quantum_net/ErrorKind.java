// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

/// The kinds of failure a protocol run can report. Timeouts and security aborts are listed as they surface in result
/// records, yet neither is a bug: a timed out receive is an expected outcome and an aborted key exchange is the
/// protocol working as intended.
public enum ErrorKind {
  /// A bad topology, node, link, channel or protocol argument.
  CONFIGURATION,
  /// An unknown node, qubit, pair, link, channel or route.
  REFERENCE,
  /// Qubit hosting or memory capacity exceeded at a node.
  RESOURCE,
  /// Operating on a consumed or collapsed qubit.
  STATE,
  /// A channel queue was full on send.
  CAPACITY_EXCEEDED,
  /// A receive deadline passed.
  TIMED_OUT,
  /// The estimated quantum bit error rate exceeded the security threshold.
  SECURITY_ABORTED
}
