package io.relaypay.merchant.notification;

/** Event names pushed to realtime subscribers. */
public final class RealtimeEvents {

  public static final String PAYMENT_RECEIVED = "payment-received";
  public static final String CONFIRMATION_UPDATE = "confirmation-update";
  public static final String PAYMENT_CONFIRMED = "payment-confirmed";

  private RealtimeEvents() {}
}
