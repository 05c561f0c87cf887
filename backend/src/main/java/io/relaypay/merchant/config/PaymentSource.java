package io.relaypay.merchant.config;

/** Where the on-chain record of a payment is read from. */
public enum PaymentSource {

  /** {@code getPayment(bytes32)} on the payment database contract. */
  PAYMENT_DATABASE,

  /** {@code PaymentCompleted} logs emitted by the payment router. */
  PAYMENT_EVENTS
}
