package io.relaypay.merchant.ledger;

/** Payment status codes stored by the payment database contract. */
public enum OnChainPaymentStatus {
  PENDING,
  COMPLETED,
  FAILED,
  REFUNDED,
  UNKNOWN;

  public static OnChainPaymentStatus fromCode(int code) {
    return switch (code) {
      case 0 -> PENDING;
      case 1 -> COMPLETED;
      case 2 -> FAILED;
      case 3 -> REFUNDED;
      default -> UNKNOWN;
    };
  }
}
