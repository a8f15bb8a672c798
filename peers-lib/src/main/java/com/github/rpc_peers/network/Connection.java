// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

import io.grpc.Context;

import java.io.IOException;

/// A single physical, bidirectional link to one remote address. The transport owns the state machine;
/// the peer core only reads the state, starts calls and closes the link.
public interface Connection extends AutoCloseable {

  /// The current lifecycle state. Must be safe to call from any thread at any time.
  ConnectionState state();

  /// Whether new calls may be started on this connection.
  default boolean isActive() {
    return state() == ConnectionState.ACTIVE;
  }

  /// Starts an outbound call. Implementations must fail promptly with `ContextDoneException` once `context` is
  /// cancelled or its deadline passes.
  OutboundCall beginCall(Context context, String serviceName, CallOptions callOptions, String operationName)
      throws IOException;

  @Override
  void close();
}
