package io.relaypay.merchant.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Merchant-signed attestation that a listener delivered a payment webhook. */
public interface MerchantProof {

  String signature();

  /** Receipt time in epoch milliseconds. */
  long timestamp();

  @JsonProperty("method")
  ProofMethod method();
}
