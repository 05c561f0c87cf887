package io.relaypay.merchant.order;

import java.time.Instant;

/**
 * Partial order update. Null fields are left untouched by the store.
 *
 * @param chain human-readable chain label, e.g. {@code "Chain 11155111"}
 */
public record OrderUpdate(
    OrderStatus status,
    String transactionHash,
    Long blockNumber,
    Long confirmations,
    String chain,
    String merchantAddress,
    String customerAddress,
    Instant confirmedAt) {

  public static OrderUpdate confirmations(long confirmations) {
    return new OrderUpdate(null, null, null, confirmations, null, null, null, null);
  }

  public static OrderUpdate confirmed(Instant confirmedAt) {
    return new OrderUpdate(
        OrderStatus.PAYMENT_CONFIRMED, null, null, null, null, null, null, confirmedAt);
  }
}
