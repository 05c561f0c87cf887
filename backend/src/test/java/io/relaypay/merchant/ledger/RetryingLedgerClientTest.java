package io.relaypay.merchant.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.relaypay.merchant.config.LedgerProperties;
import java.net.ConnectException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryingLedgerClientTest {

  private final LedgerClient ledger = mock(LedgerClient.class);

  @Test
  void call_succeedsAfterTwoTransientFailures() {
    var client = new RetryingLedgerClient(ledger, properties(Duration.ofMillis(1)));
    when(ledger.getBlockNumber())
        .thenThrow(new TransientLedgerException("request timed out"))
        .thenThrow(new LedgerException("eth_blockNumber failed", new ConnectException("refused")))
        .thenReturn(42L);

    long block = client.read("getBlockNumber", LedgerClient::getBlockNumber);

    assertThat(block).isEqualTo(42L);
    verify(ledger, times(3)).getBlockNumber();
  }

  @Test
  void call_propagatesLastErrorAfterThreeTransientFailures() {
    var client = new RetryingLedgerClient(ledger, properties(Duration.ofMillis(1)));
    when(ledger.getBlockNumber())
        .thenThrow(new TransientLedgerException("timeout 1"))
        .thenThrow(new TransientLedgerException("timeout 2"))
        .thenThrow(new TransientLedgerException("timeout 3"))
        .thenReturn(42L);

    assertThatThrownBy(() -> client.read("getBlockNumber", LedgerClient::getBlockNumber))
        .isInstanceOf(TransientLedgerException.class)
        .hasMessage("timeout 3");
    verify(ledger, times(3)).getBlockNumber();
  }

  @Test
  void call_propagatesNonTransientErrorImmediately() {
    var client = new RetryingLedgerClient(ledger, properties(Duration.ofSeconds(2)));
    when(ledger.getBlockNumber()).thenThrow(new LedgerException("execution reverted"));

    long started = System.nanoTime();
    assertThatThrownBy(() -> client.read("getBlockNumber", LedgerClient::getBlockNumber))
        .isInstanceOf(LedgerException.class)
        .hasMessage("execution reverted");
    long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

    verify(ledger, times(1)).getBlockNumber();
    assertThat(elapsedMs).isLessThan(1000);
  }

  @Test
  void call_waitsBetweenAttempts() {
    var client = new RetryingLedgerClient(ledger, properties(Duration.ofMillis(50)));
    when(ledger.getBlockNumber())
        .thenThrow(new TransientLedgerException("network unreachable"))
        .thenReturn(7L);

    long started = System.nanoTime();
    client.read("getBlockNumber", LedgerClient::getBlockNumber);

    assertThat(Duration.ofNanos(System.nanoTime() - started).toMillis()).isGreaterThanOrEqualTo(45);
  }

  private static LedgerProperties properties(Duration initialBackoff) {
    return new LedgerProperties(
        null,
        0,
        null,
        null,
        null,
        0,
        new LedgerProperties.Retry(3, initialBackoff, initialBackoff.multipliedBy(5)));
  }
}
