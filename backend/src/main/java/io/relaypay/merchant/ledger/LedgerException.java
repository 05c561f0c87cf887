package io.relaypay.merchant.ledger;

/** A ledger read failed. Not retried unless classified as transient. */
public class LedgerException extends RuntimeException {

  public LedgerException(String message) {
    super(message);
  }

  public LedgerException(String message, Throwable cause) {
    super(message, cause);
  }
}
