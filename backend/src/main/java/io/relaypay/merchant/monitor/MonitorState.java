package io.relaypay.merchant.monitor;

/** Lifecycle of a monitoring job. CONFIRMED and CANCELLED are terminal. */
public enum MonitorState {
  IDLE,
  MONITORING,
  CONFIRMED,
  CANCELLED;

  boolean isTerminal() {
    return this == CONFIRMED || this == CANCELLED;
  }
}
