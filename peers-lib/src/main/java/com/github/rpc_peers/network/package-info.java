// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The network package holds the transport abstractions the peer core depends on.
///
/// Key interfaces:
/// - `Connector`: dials a new outbound `Connection` to a `host:port`
/// - `Connection`: one physical bidirectional link with its own lifecycle
/// - `OutboundCall`: the handle a connection returns when a call is started
/// - `ContextDoneException`: the failure of a dial or call whose `io.grpc.Context` is done
///
/// Design characteristics:
/// 1. Framing, handshakes and the connection state machine belong to the transport, not to this core
/// 2. Options are immutable records that the core forwards without interpreting
/// 3. Blocking operations take the caller's `io.grpc.Context` and must give up once it is cancelled or expired
package com.github.rpc_peers.network;
