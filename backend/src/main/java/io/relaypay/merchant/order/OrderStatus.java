package io.relaypay.merchant.order;

public enum OrderStatus {
  PENDING,
  PAYMENT_PENDING,
  PAYMENT_CONFIRMED,
  FULFILLED,
  CANCELLED
}
