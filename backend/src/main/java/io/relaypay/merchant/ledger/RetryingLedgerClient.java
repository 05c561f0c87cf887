package io.relaypay.merchant.ledger;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.relaypay.merchant.config.LedgerProperties;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs ledger reads under a bounded exponential-backoff retry. Only transient failures (see {@link
 * LedgerFailures#isTransient}) are retried; anything else propagates on the first attempt. When the
 * attempts run out the last failure is rethrown unchanged.
 *
 * <p>Backoff waits block only the calling thread.
 */
@Component
public class RetryingLedgerClient {

  private static final Logger log = LoggerFactory.getLogger(RetryingLedgerClient.class);

  private final LedgerClient ledger;
  private final Retry retry;

  public RetryingLedgerClient(LedgerClient ledger, LedgerProperties properties) {
    this.ledger = ledger;
    var policy = properties.retry();
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(policy.maxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    policy.initialBackoff(), 2.0, policy.maxBackoff()))
            .retryOnException(LedgerFailures::isTransient)
            .build();
    this.retry = Retry.of("ledger", config);
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.debug(
                    "Retrying ledger call (attempt {}/{}) after {}ms: {}",
                    event.getNumberOfRetryAttempts(),
                    policy.maxAttempts(),
                    event.getWaitInterval().toMillis(),
                    LedgerFailures.describe(event.getLastThrowable())));
  }

  public <T> T call(String operation, Supplier<T> call) {
    try {
      return Retry.decorateSupplier(retry, call).get();
    } catch (RuntimeException e) {
      log.debug("Ledger call {} gave up: {}", operation, LedgerFailures.describe(e));
      throw e;
    }
  }

  /** Runs {@code read} against the wrapped client under the retry policy. */
  public <T> T read(String operation, Function<LedgerClient, T> read) {
    return call(operation, () -> read.apply(ledger));
  }
}
