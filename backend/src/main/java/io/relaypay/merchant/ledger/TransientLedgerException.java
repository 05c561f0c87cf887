package io.relaypay.merchant.ledger;

/** A ledger read failed for a reason worth retrying: timeout or unreachable node. */
public class TransientLedgerException extends LedgerException {

  public TransientLedgerException(String message) {
    super(message);
  }

  public TransientLedgerException(String message, Throwable cause) {
    super(message, cause);
  }
}
