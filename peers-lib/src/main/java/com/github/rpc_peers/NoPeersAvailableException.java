// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

/// A peer was requested from a list that has no peers. The caller may retry later or fall back to another list.
public final class NoPeersAvailableException extends PeerException {
  public NoPeersAvailableException() {
    super("no peers available");
  }
}
