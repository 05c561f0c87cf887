package io.relaypay.merchant.webhook;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.Map;

/**
 * Payment notification as pushed by a listener. Nothing in it is trusted until verified against
 * the ledger.
 *
 * @param timestamp payment time, in seconds or milliseconds since the epoch
 */
public record WebhookClaim(
    @NotBlank
        @Pattern(
            regexp = "payment\\.(completed|pending|confirmed|failed)",
            message = "must be one of payment.completed, payment.pending, payment.confirmed,"
                + " payment.failed")
        String type,
    @JsonProperty("payment_id") @NotBlank String paymentId,
    @NotBlank String merchant,
    @NotBlank String customer,
    @NotBlank String amount,
    @JsonProperty("amount_wei") String amountWei,
    @JsonProperty("merchant_amount") String merchantAmount,
    @JsonProperty("platform_fee") String platformFee,
    @JsonProperty("listener_fee") String listenerFee,
    @NotNull Long timestamp,
    @JsonProperty("block_number") @NotNull Long blockNumber,
    @JsonProperty("transaction_hash") @NotBlank String transactionHash,
    @JsonProperty("chain_id") @NotNull Long chainId,
    Map<String, Object> metadata) {

  private static final long MILLIS_THRESHOLD = 1_000_000_000_000L;

  @JsonIgnore
  public ClaimType claimType() {
    return ClaimType.fromWire(type);
  }

  /** {@link #timestamp()} normalized to epoch milliseconds. */
  @JsonIgnore
  public long timestampMillis() {
    return timestamp < MILLIS_THRESHOLD ? timestamp * 1000 : timestamp;
  }
}
