// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/// Picks a peer uniformly at random. This is the default strategy.
public class RandomPeerSelector implements PeerSelector {
  final RandomGenerator random;

  public RandomPeerSelector(RandomGenerator random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public Peer choosePeer(List<Peer> peers) {
    return peers.get(random.nextInt(peers.size()));
  }
}
