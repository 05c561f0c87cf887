package io.relaypay.merchant.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection and contract settings for the remote ledger.
 *
 * @param rpcUrl JSON-RPC endpoint of the chain node
 * @param chainId chain id the contracts are deployed on
 * @param listenerRegistryAddress address of the listener registry contract
 * @param paymentDatabaseAddress address of the payment database contract
 * @param paymentRouterAddress address of the router that emits {@code PaymentCompleted}
 * @param eventLookbackBlocks how many blocks back the event search reaches
 * @param retry retry policy for transient RPC failures
 */
@ConfigurationProperties(prefix = "relaypay.ledger")
public record LedgerProperties(
    String rpcUrl,
    long chainId,
    String listenerRegistryAddress,
    String paymentDatabaseAddress,
    String paymentRouterAddress,
    long eventLookbackBlocks,
    Retry retry) {

  public LedgerProperties {
    if (rpcUrl == null || rpcUrl.isBlank()) {
      rpcUrl = "http://localhost:8545";
    }
    if (chainId <= 0) {
      chainId = 11155111L;
    }
    if (listenerRegistryAddress == null) {
      listenerRegistryAddress = "0xC5ea445f72537770ad7A6895879157f7eA9fb065";
    }
    if (paymentDatabaseAddress == null) {
      paymentDatabaseAddress = "0x1074c816F94bfB28f07B38E6372a87F7bD6ce365";
    }
    if (paymentRouterAddress == null) {
      paymentRouterAddress = "0x60a13C4C324f9d080eede15eb976599F9D0cD0ce";
    }
    if (eventLookbackBlocks <= 0) {
      eventLookbackBlocks = 10_000L;
    }
    if (retry == null) {
      retry = new Retry(0, null, null);
    }
  }

  /**
   * @param maxAttempts total attempts including the first call
   * @param initialBackoff wait after the first failed attempt, doubled after each further failure
   * @param maxBackoff upper bound for a single wait
   */
  public record Retry(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public Retry {
      if (maxAttempts <= 0) {
        maxAttempts = 3;
      }
      if (initialBackoff == null) {
        initialBackoff = Duration.ofSeconds(1);
      }
      if (maxBackoff == null) {
        maxBackoff = Duration.ofSeconds(5);
      }
    }
  }
}
