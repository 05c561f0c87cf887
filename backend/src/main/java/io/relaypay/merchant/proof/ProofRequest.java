package io.relaypay.merchant.proof;

import java.time.Instant;

/**
 * What a proof attests to.
 *
 * @param paymentId 0x-prefixed bytes32 payment id
 * @param listenerAddress listener that delivered the webhook
 * @param timestamp time of receipt; must be recent
 * @param orderId merchant order id, may be null
 * @param amount payment amount in ETH, may be null
 */
public record ProofRequest(
    String paymentId, String listenerAddress, Instant timestamp, String orderId, String amount) {}
