// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

/// Lifecycle of a transport connection as observed by the peer core.
public enum ConnectionState {
  /// Open for new calls in both directions.
  ACTIVE,
  /// Close has been requested; in-flight calls are draining.
  START_CLOSE,
  /// The remote side has no more inbound calls outstanding.
  INBOUND_CLOSED,
  /// Fully closed.
  CLOSED;

  /// Only connections that are active or draining may be registered with a peer.
  public boolean canRegister() {
    return this == ACTIVE || this == START_CLOSE;
  }
}
