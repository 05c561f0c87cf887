package io.relaypay.merchant.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Answer to a claim whose payment id was already processed. Never carries a proof. */
public record ReplayedWebhookResponse(
    String status,
    String message,
    @JsonProperty("processed_by") String processedBy,
    @JsonProperty("processed_at") Long processedAt,
    Object proof)
    implements WebhookResponse {

  static ReplayedWebhookResponse of(String processedBy, Long processedAt) {
    return new ReplayedWebhookResponse(
        "already_processed", "This payment was already handled", processedBy, processedAt, null);
  }
}
