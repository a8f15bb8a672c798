// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

import lombok.With;

/// Options handed to the `Connector` whenever a peer dials a new outbound connection. The peer core
/// forwards them untouched.
@With
public record ConnectionOptions(
    int sendBufferSize,
    int receiveBufferSize,
    ChecksumType checksumType,
    String processName
) {
  public static final int DEFAULT_BUFFER_SIZE = 512;

  public enum ChecksumType {
    NONE, CRC32, FARMHASH32
  }

  public ConnectionOptions {
    if (sendBufferSize <= 0) {
      throw new IllegalArgumentException("sendBufferSize must be positive: " + sendBufferSize);
    }
    if (receiveBufferSize <= 0) {
      throw new IllegalArgumentException("receiveBufferSize must be positive: " + receiveBufferSize);
    }
    if (checksumType == null) {
      throw new IllegalArgumentException("checksumType required");
    }
    processName = processName == null ? "" : processName;
  }

  public static ConnectionOptions defaults() {
    return new ConnectionOptions(DEFAULT_BUFFER_SIZE, DEFAULT_BUFFER_SIZE, ChecksumType.CRC32, "");
  }
}
