package io.relaypay.merchant.verification;

import java.util.Map;

/**
 * Outcome of a single verification step. {@code reason} is set only when {@code valid} is false and
 * is meant to be read by the relay operator. {@code degraded} marks a result that was accepted
 * without a verdict from the ledger.
 */
public record VerificationResult(
    boolean valid, String reason, boolean degraded, Map<String, Object> data) {

  public VerificationResult {
    data = (data == null) ? Map.of() : Map.copyOf(data);
  }

  public static VerificationResult ok(Map<String, Object> data) {
    return new VerificationResult(true, null, false, data);
  }

  /** Accepted without a ledger verdict. The explanation belongs in {@code data}. */
  public static VerificationResult degraded(Map<String, Object> data) {
    return new VerificationResult(true, null, true, data);
  }

  public static VerificationResult failure(String reason) {
    return new VerificationResult(false, reason, false, Map.of());
  }

  public static VerificationResult failure(String reason, Map<String, Object> data) {
    return new VerificationResult(false, reason, false, data);
  }
}
