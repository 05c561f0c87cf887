package io.relaypay.merchant.notification;

public enum EmailKind {
  PAYMENT_RECEIVED,
  PAYMENT_CONFIRMED
}
