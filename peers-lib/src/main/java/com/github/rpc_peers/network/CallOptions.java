// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

import lombok.With;

/// Per call options forwarded to `Connection#beginCall`.
@With
public record CallOptions(Format format, String shardKey, String routingDelegate) {

  /// The argument scheme of the call.
  public enum Format {
    RAW, JSON, THRIFT
  }

  /// Used when a caller does not supply options.
  public static final CallOptions DEFAULT = new CallOptions(Format.RAW, "", "");

  public CallOptions {
    format = format == null ? Format.RAW : format;
    shardKey = shardKey == null ? "" : shardKey;
    routingDelegate = routingDelegate == null ? "" : routingDelegate;
  }
}
