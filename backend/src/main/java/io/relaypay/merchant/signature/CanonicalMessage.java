package io.relaypay.merchant.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relaypay.merchant.webhook.WebhookClaim;
import java.util.LinkedHashMap;

/**
 * The exact text a listener signs for a webhook: a compact JSON object holding {@code type,
 * payment_id, merchant, amount, timestamp, chain_id} in that order. Relays serialize the same way,
 * so field order and formatting are part of the wire contract.
 */
public final class CanonicalMessage {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private CanonicalMessage() {}

  public static String of(WebhookClaim claim) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("type", claim.type());
    fields.put("payment_id", claim.paymentId());
    fields.put("merchant", claim.merchant());
    fields.put("amount", claim.amount());
    fields.put("timestamp", claim.timestamp());
    fields.put("chain_id", claim.chainId());
    try {
      return MAPPER.writeValueAsString(fields);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Canonical webhook message could not be serialized", e);
    }
  }
}
