// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The peer and connection management core of an RPC client.
///
/// - `PeerList`: concurrent registry from `host:port` to `Peer`, composable into a root/child/sibling tree
/// - `Peer`: one remote address and its pool of inbound and outbound connections
/// - `PeerSelector`: pluggable strategy that picks the peer for the next call
///
/// A caller asks a list for a peer, by address or by strategy, and then asks the peer to begin a call. The peer
/// reuses an active connection or dials a new one through the `network.Connector`.
package com.github.rpc_peers;
