package io.relaypay.merchant.config;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thresholds and modes for webhook verification.
 *
 * @param minListenerStake minimum registry stake, in ETH
 * @param minListenerReputation minimum registry reputation score
 * @param minConfirmations confirmations a payment transaction needs at ingestion time
 * @param listenerMode {@code STRICT} or {@code DEGRADED_ON_FAILURE}
 * @param paymentMode {@code STRICT} or {@code VERIFICATION_DISABLED}
 * @param paymentSource where payment records are read from
 * @param requireSignedWebhooks reject webhooks that carry no listener signature
 */
@ConfigurationProperties(prefix = "relaypay.verification")
public record VerificationProperties(
    BigDecimal minListenerStake,
    Integer minListenerReputation,
    Integer minConfirmations,
    VerificationMode listenerMode,
    VerificationMode paymentMode,
    PaymentSource paymentSource,
    boolean requireSignedWebhooks) {

  public VerificationProperties {
    if (minListenerStake == null) {
      minListenerStake = new BigDecimal("0.01");
    }
    if (minListenerReputation == null) {
      minListenerReputation = 30;
    }
    if (minConfirmations == null) {
      minConfirmations = 3;
    }
    if (listenerMode == null) {
      listenerMode = VerificationMode.STRICT;
    }
    if (paymentMode == null) {
      paymentMode = VerificationMode.STRICT;
    }
    if (paymentSource == null) {
      paymentSource = PaymentSource.PAYMENT_DATABASE;
    }
    if (listenerMode == VerificationMode.VERIFICATION_DISABLED) {
      throw new IllegalStateException(
          "relaypay.verification.listener-mode must be STRICT or DEGRADED_ON_FAILURE");
    }
    if (paymentMode == VerificationMode.DEGRADED_ON_FAILURE) {
      throw new IllegalStateException(
          "relaypay.verification.payment-mode must be STRICT or VERIFICATION_DISABLED");
    }
  }

  public static VerificationProperties defaults() {
    return new VerificationProperties(null, null, null, null, null, null, false);
  }
}
