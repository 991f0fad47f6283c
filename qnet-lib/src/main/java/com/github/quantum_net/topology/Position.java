// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.topology;

public record Position(double x, double y, double z) {
  public double distanceTo(Position other) {
    final double dx = x - other.x;
    final double dy = y - other.y;
    final double dz = z - other.z;
    return Math.sqrt(dx * dx + dy * dy + dz * dz);
  }
}
