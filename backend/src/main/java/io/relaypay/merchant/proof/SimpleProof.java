package io.relaypay.merchant.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

/** @param message hex of {@code keccak256(paymentId, listener)} */
public record SimpleProof(String message, String signature, long timestamp)
    implements MerchantProof {

  @Override
  @JsonProperty("method")
  public ProofMethod method() {
    return ProofMethod.SIMPLE;
  }
}
