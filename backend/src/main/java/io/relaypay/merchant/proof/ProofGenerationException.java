package io.relaypay.merchant.proof;

/** A proof request was rejected before anything was signed. */
public class ProofGenerationException extends RuntimeException {

  public enum Reason {
    INVALID_PARAMETER,
    STALE_TIMESTAMP,
    FUTURE_TIMESTAMP
  }

  private final Reason reason;

  public ProofGenerationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
