package io.relaypay.merchant.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.relaypay.merchant.proof.MerchantProof;
import io.relaypay.merchant.proof.ProofMethod;
import io.relaypay.merchant.proof.SimpleProof;
import io.relaypay.merchant.proof.TypedDataProof;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire form of a merchant proof. {@code signed_message} is the signed hash for simple proofs and
 * the EIP-712 digest for typed proofs; typed proofs add the full typed data.
 */
public record ProofView(
    @JsonProperty("payment_id") String paymentId,
    String listener,
    @JsonProperty("merchant_signature") String merchantSignature,
    @JsonProperty("signed_message") String signedMessage,
    long timestamp,
    ProofMethod method,
    @JsonProperty("typed_data") @JsonInclude(JsonInclude.Include.NON_NULL)
        Map<String, Object> typedData) {

  static ProofView of(String paymentId, String listener, MerchantProof proof) {
    if (proof instanceof TypedDataProof typed) {
      var typedData = new LinkedHashMap<String, Object>();
      typedData.put("domain", typed.domain());
      typedData.put("types", typed.types());
      typedData.put("primaryType", "WebhookConfirmation");
      typedData.put("message", typed.value());
      return new ProofView(
          paymentId,
          listener,
          typed.signature(),
          typed.digest(),
          typed.timestamp(),
          typed.method(),
          typedData);
    }
    var simple = (SimpleProof) proof;
    return new ProofView(
        paymentId,
        listener,
        simple.signature(),
        simple.message(),
        simple.timestamp(),
        simple.method(),
        null);
  }
}
