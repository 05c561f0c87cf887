package io.relaypay.merchant.ledger;

import java.math.BigInteger;

/** Decoded {@code PaymentCompleted} log of the payment router. Amounts are in wei. */
public record PaymentCompletedEvent(
    String paymentId,
    String merchant,
    BigInteger merchantAmount,
    BigInteger platformFee,
    BigInteger listenerFee,
    long blockNumber,
    String transactionHash) {

  public BigInteger totalAmount() {
    return merchantAmount.add(platformFee).add(listenerFee);
  }
}
