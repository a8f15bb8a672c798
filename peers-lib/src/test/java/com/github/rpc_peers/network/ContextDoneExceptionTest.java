// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

import io.grpc.Context;
import io.grpc.Deadline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

class ContextDoneExceptionTest {

  /// A ticker the test moves by hand.
  static final class ManualTicker extends Deadline.Ticker {
    final AtomicLong nanos = new AtomicLong();

    @Override
    public long nanoTime() {
      return nanos.get();
    }

    void advance(long amount, TimeUnit unit) {
      nanos.addAndGet(unit.toNanos(amount));
    }
  }

  ScheduledExecutorService scheduler;

  @BeforeEach
  void setup() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
  }

  @AfterEach
  void cleanup() {
    scheduler.shutdownNow();
  }

  @Test
  void rootContextIsNeverDone() {
    assertThatCode(() -> ContextDoneException.throwIfDone(Context.ROOT)).doesNotThrowAnyException();
  }

  @Test
  void cancellationIsReportedWithItsCause() {
    final var context = Context.ROOT.withCancellation();
    final var cause = new IllegalStateException("shutting down");
    context.cancel(cause);

    assertThatThrownBy(() -> ContextDoneException.throwIfDone(context))
        .isInstanceOfSatisfying(ContextDoneException.class, e -> {
          assertThat(e.reason()).isEqualTo(ContextDoneException.Reason.CANCELED);
          assertThat(e).hasMessage("context canceled").hasCause(cause);
        });
  }

  @Test
  void cancellingAParentEndsItsDerivedContexts() {
    final var parent = Context.ROOT.withCancellation();
    final var child = parent.withCancellation();

    parent.cancel(null);

    assertThatThrownBy(() -> ContextDoneException.throwIfDone(child))
        .isInstanceOfSatisfying(ContextDoneException.class,
            e -> assertThat(e.reason()).isEqualTo(ContextDoneException.Reason.CANCELED));
  }

  @Test
  void cancellingAChildLeavesTheParentActive() {
    final var parent = Context.ROOT.withCancellation();
    final var child = parent.withCancellation();

    child.cancel(null);

    assertThatCode(() -> ContextDoneException.throwIfDone(parent)).doesNotThrowAnyException();
  }

  @Test
  void expiredDeadlineIsReportedBeforeTheSchedulerFires() {
    final var ticker = new ManualTicker();
    final var context = Context.ROOT.withDeadline(Deadline.after(1, TimeUnit.HOURS, ticker), scheduler);

    assertThatCode(() -> ContextDoneException.throwIfDone(context)).doesNotThrowAnyException();

    ticker.advance(2, TimeUnit.HOURS);

    assertThatThrownBy(() -> ContextDoneException.throwIfDone(context))
        .isInstanceOfSatisfying(ContextDoneException.class, e -> {
          assertThat(e.reason()).isEqualTo(ContextDoneException.Reason.DEADLINE_EXCEEDED);
          assertThat(e).hasMessage("context deadline exceeded");
        });
  }

  @Test
  void deadlineCancellationIsReportedAsExceeded() {
    final var context = Context.ROOT.withDeadlineAfter(-1, TimeUnit.MILLISECONDS, scheduler);

    assertThatThrownBy(() -> ContextDoneException.throwIfDone(context))
        .isInstanceOfSatisfying(ContextDoneException.class, e -> {
          assertThat(e.reason()).isEqualTo(ContextDoneException.Reason.DEADLINE_EXCEEDED);
          assertThat(e.getCause()).isInstanceOf(TimeoutException.class);
        });
  }
}
