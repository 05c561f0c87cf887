package io.relaypay.merchant.proof;

import com.fasterxml.jackson.annotation.JsonValue;

/** Signature scheme of a merchant proof. */
public enum ProofMethod {

  /** Personal-sign over {@code keccak256(paymentId, listener)}. */
  SIMPLE("simple"),

  /** EIP-712 typed-data signature bound to chain id and verifying contract. */
  EIP712("eip712");

  private final String wireName;

  ProofMethod(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
