package io.relaypay.merchant.webhook;

import java.util.Arrays;

public enum ClaimType {
  COMPLETED("payment.completed"),
  PENDING("payment.pending"),
  CONFIRMED("payment.confirmed"),
  FAILED("payment.failed");

  private final String wireName;

  ClaimType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static ClaimType fromWire(String value) {
    return Arrays.stream(values())
        .filter(t -> t.wireName.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown webhook type: " + value));
  }

  /** Types that still need the confirmation depth tracked. */
  boolean startsMonitoring() {
    return this == COMPLETED || this == PENDING;
  }
}
