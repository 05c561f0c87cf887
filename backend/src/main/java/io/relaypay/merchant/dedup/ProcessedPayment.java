package io.relaypay.merchant.dedup;

import java.time.Instant;

/**
 * The first accepted delivery of a payment id. Later claims for the same id are answered with a
 * pointer to this entry.
 *
 * @param signature merchant proof signature issued for the delivery, empty when none was issued
 */
public record ProcessedPayment(
    String paymentId, String listenerAddress, String signature, Instant firstSeenAt) {}
