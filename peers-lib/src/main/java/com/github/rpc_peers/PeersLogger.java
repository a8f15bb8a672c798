// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers;

import java.util.logging.Logger;

/// The single logger of the peer core. Messages are built lazily so that the hot lookup paths cost nothing
/// when fine grained logging is off.
public final class PeersLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.rpc_peers");

  private PeersLogger() {
  }
}
