// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

/// Failures raised by the peer core itself. Transport failures are surfaced as the `IOException` the
/// transport threw.
public abstract sealed class PeerException extends Exception
    permits NoPeersAvailableException, InvalidConnectionStateException {

  protected PeerException(String message) {
    super(message);
  }
}
