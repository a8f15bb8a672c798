// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

import java.util.List;

/// The strategy a `PeerList` uses to pick the peer that carries the next call. The list hands over its peers in
/// insertion order and never an empty list.
///
/// A list calls its selector while holding its read lock, so several threads may call `choosePeer`
/// concurrently. Implementations must be thread safe and must not block.
@FunctionalInterface
public interface PeerSelector {
  Peer choosePeer(List<Peer> peers);
}
