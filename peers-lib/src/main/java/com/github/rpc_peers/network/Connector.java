// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

import io.grpc.Context;

import java.io.IOException;

/// The peer core is agnostic to the underlying transport. The owning channel implements this interface so
/// that peers can dial new outbound connections without holding a reference back to the channel.
public interface Connector {

  /// Establishes a new outbound connection. Implementations must abort the dial promptly once `context` is
  /// cancelled or its deadline passes, typically through `Context#addListener`, and fail with
  /// `ContextDoneException`.
  Connection connect(Context context, String hostPort, ConnectionOptions options) throws IOException;

  /// The options new outbound connections are dialed with.
  ConnectionOptions connectionOptions();
}
