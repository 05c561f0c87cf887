package io.relaypay.merchant.proof;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * EIP-712 proof. {@code domain}, {@code types} and {@code value} are everything a verifier needs
 * to rebuild {@code digest}.
 */
public record TypedDataProof(
    Map<String, Object> domain,
    Map<String, List<Map<String, String>>> types,
    Map<String, Object> value,
    String digest,
    String signature,
    long timestamp)
    implements MerchantProof {

  @Override
  @JsonProperty("method")
  public ProofMethod method() {
    return ProofMethod.EIP712;
  }
}
