package io.relaypay.merchant.config;

/**
 * How a verifier reacts when it cannot reach a verdict. Resolved once from configuration when the
 * verifier is constructed.
 */
public enum VerificationMode {

  /** Verify everything; an unreachable ledger rejects the claim. */
  STRICT,

  /** Accept the claim, flagged as degraded, when the ledger stays unreachable after retries. */
  DEGRADED_ON_FAILURE,

  /** Skip the check altogether. Only meant for test networks. */
  VERIFICATION_DISABLED
}
