package io.relaypay.merchant.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param signature merchant proof signature, duplicated at top level for older listeners
 * @param proof null when no listener address was given or proof generation failed
 * @param order null when no matching order exists
 */
public record ProcessedWebhookResponse(
    String status,
    String message,
    String signature,
    ProofView proof,
    OrderView order,
    @JsonProperty("processing_time_ms") long processingTimeMs)
    implements WebhookResponse {

  static ProcessedWebhookResponse success(ProofView proof, OrderView order, long elapsedMs) {
    return new ProcessedWebhookResponse(
        "success",
        "Payment processed successfully",
        proof == null ? null : proof.merchantSignature(),
        proof,
        order,
        elapsedMs);
  }
}
