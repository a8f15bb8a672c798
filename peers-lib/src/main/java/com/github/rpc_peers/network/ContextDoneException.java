// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

import io.grpc.Context;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/// Raised when a dial or call is abandoned because its `io.grpc.Context` was cancelled or ran past its deadline.
/// The cancellation cause of the context, when it has one, is kept as the cause of this exception.
public class ContextDoneException extends IOException {

  public enum Reason {
    CANCELED, DEADLINE_EXCEEDED
  }

  private final Reason reason;

  public ContextDoneException(Reason reason, Throwable cause) {
    super(reason == Reason.CANCELED ? "context canceled" : "context deadline exceeded", cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /// Fails if `context` is cancelled or its deadline has passed. A deadline counts as passed as soon as it
  /// expires, even before the context's scheduler has run the cancellation.
  public static void throwIfDone(Context context) throws ContextDoneException {
    final var deadline = context.getDeadline();
    if (context.isCancelled()) {
      final var cause = context.cancellationCause();
      final var expired = cause instanceof TimeoutException || (deadline != null && deadline.isExpired());
      throw new ContextDoneException(expired ? Reason.DEADLINE_EXCEEDED : Reason.CANCELED, cause);
    }
    if (deadline != null && deadline.isExpired()) {
      throw new ContextDoneException(Reason.DEADLINE_EXCEEDED, null);
    }
  }
}
