package io.relaypay.merchant.ledger;

import java.math.BigInteger;

/**
 * Decoded {@code getPayment(bytes32)} tuple of the payment database.
 *
 * @param paymentId 0x-prefixed bytes32; all zeros when the id is unknown
 * @param amount amount in wei
 * @param timestamp unix seconds
 * @param orderId 0x-prefixed bytes32
 */
public record PaymentRecord(
    String paymentId,
    String merchant,
    String customer,
    BigInteger amount,
    BigInteger timestamp,
    int paymentType,
    OnChainPaymentStatus status,
    String orderId,
    BigInteger nonce) {

  private static final String ZERO_HASH =
      "0x0000000000000000000000000000000000000000000000000000000000000000";

  public boolean exists() {
    return paymentId != null && !ZERO_HASH.equalsIgnoreCase(paymentId);
  }
}
