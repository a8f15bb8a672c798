// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

/// A call that has been started on a connection. Writing arguments and reading the response is the business of
/// the transport.
public interface OutboundCall {
  String serviceName();

  String operationName();

  CallOptions callOptions();
}
