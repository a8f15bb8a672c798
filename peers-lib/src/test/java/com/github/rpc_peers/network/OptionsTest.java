// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rpc_peers.network;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class OptionsTest {

  @Test
  void connectionOptionDefaults() {
    final var defaults = ConnectionOptions.defaults();

    assertThat(defaults.sendBufferSize()).isEqualTo(ConnectionOptions.DEFAULT_BUFFER_SIZE);
    assertThat(defaults.receiveBufferSize()).isEqualTo(ConnectionOptions.DEFAULT_BUFFER_SIZE);
    assertThat(defaults.checksumType()).isEqualTo(ConnectionOptions.ChecksumType.CRC32);
    assertThat(defaults.processName()).isEmpty();
  }

  @Test
  void withCopiesLeaveTheOriginalUnchanged() {
    final var defaults = ConnectionOptions.defaults();

    final var tuned = defaults.withReceiveBufferSize(8192).withChecksumType(ConnectionOptions.ChecksumType.NONE);

    assertThat(tuned.receiveBufferSize()).isEqualTo(8192);
    assertThat(tuned.checksumType()).isEqualTo(ConnectionOptions.ChecksumType.NONE);
    assertThat(defaults).isEqualTo(ConnectionOptions.defaults());
  }

  @Test
  void connectionOptionsRejectNonPositiveBuffers() {
    assertThatIllegalArgumentException().isThrownBy(() -> ConnectionOptions.defaults().withSendBufferSize(0));
    assertThatIllegalArgumentException().isThrownBy(() -> ConnectionOptions.defaults().withReceiveBufferSize(-1));
    assertThatIllegalArgumentException().isThrownBy(() -> ConnectionOptions.defaults().withChecksumType(null));
  }

  @Test
  void callOptionsFillInMissingValues() {
    final var options = new CallOptions(null, null, null);

    assertThat(options).isEqualTo(CallOptions.DEFAULT);
    assertThat(CallOptions.DEFAULT.withShardKey("user-1").format()).isEqualTo(CallOptions.Format.RAW);
  }

  @Test
  void onlyActiveAndDrainingConnectionsCanRegister() {
    assertThat(ConnectionState.ACTIVE.canRegister()).isTrue();
    assertThat(ConnectionState.START_CLOSE.canRegister()).isTrue();
    assertThat(ConnectionState.INBOUND_CLOSED.canRegister()).isFalse();
    assertThat(ConnectionState.CLOSED.canRegister()).isFalse();
  }
}
