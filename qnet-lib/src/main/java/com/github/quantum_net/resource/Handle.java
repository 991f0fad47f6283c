// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net.resource;

/// A stable reference into an [Arena]. The generation is bumped every time a slot is released so that a handle kept
/// after its value was released can never silently reach the value that reused the slot.
public record Handle(int index, int generation) {
  public Handle {
    if (index < 0) throw new IllegalArgumentException("Handle index must be non-negative");
  }

  @Override
  public String toString() {
    return index + "v" + generation;
  }
}
