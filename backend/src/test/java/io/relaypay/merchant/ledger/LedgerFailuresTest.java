package io.relaypay.merchant.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import org.junit.jupiter.api.Test;

class LedgerFailuresTest {

  @Test
  void networkCausesAreTransient() {
    assertThat(LedgerFailures.isTransient(new LedgerException("x", new SocketTimeoutException())))
        .isTrue();
    assertThat(LedgerFailures.isTransient(new LedgerException("x", new ConnectException())))
        .isTrue();
    assertThat(LedgerFailures.isTransient(new UnknownHostException("rpc.invalid"))).isTrue();
    assertThat(LedgerFailures.isTransient(new TransientLedgerException("busy"))).isTrue();
  }

  @Test
  void messagesMentioningTimeoutOrNetworkAreTransient() {
    assertThat(LedgerFailures.isTransient(new IOException("Read Timeout"))).isTrue();
    assertThat(LedgerFailures.isTransient(new IOException("network changed"))).isTrue();
  }

  @Test
  void contractErrorsAreNotTransient() {
    assertThat(LedgerFailures.isTransient(new LedgerException("getPayment reverted: nope")))
        .isFalse();
    assertThat(LedgerFailures.isTransient(new IllegalArgumentException("bad hex"))).isFalse();
  }

  @Test
  void describeFallsBackToTypeName() {
    assertThat(LedgerFailures.describe(new IllegalStateException()))
        .isEqualTo("IllegalStateException");
  }
}
