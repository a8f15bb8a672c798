// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

import com.github.rpc_peers.network.ConnectionState;

/// A connection that was already closing or closed was offered to a peer.
public final class InvalidConnectionStateException extends PeerException {
  private final ConnectionState state;

  public InvalidConnectionStateException(ConnectionState state) {
    super("connection is in an invalid state: " + state);
    this.state = state;
  }

  public ConnectionState state() {
    return state;
  }
}
