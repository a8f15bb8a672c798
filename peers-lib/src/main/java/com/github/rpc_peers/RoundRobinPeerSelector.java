// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/// Cycles through the peers in insertion order. Peers added later join the rotation at the position the counter
/// has reached.
public class RoundRobinPeerSelector implements PeerSelector {
  private final AtomicInteger next = new AtomicInteger();

  @Override
  public Peer choosePeer(List<Peer> peers) {
    return peers.get(Math.floorMod(next.getAndIncrement(), peers.size()));
  }
}
