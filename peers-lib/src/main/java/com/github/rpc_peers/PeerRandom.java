// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

import java.util.Random;
import java.util.random.RandomGenerator;

/// Random sources for connection tie-breaks and random peer selection. Both are safe to share between threads
/// as `java.util.Random` updates its seed atomically.
public final class PeerRandom {
  private static final RandomGenerator SHARED = new Random(System.nanoTime());

  private PeerRandom() {
  }

  /// The process wide source, seeded from the clock when this class is loaded.
  public static RandomGenerator shared() {
    return SHARED;
  }

  /// A source with a fixed seed so that selections can be replayed.
  public static RandomGenerator seeded(long seed) {
    return new Random(seed);
  }
}
