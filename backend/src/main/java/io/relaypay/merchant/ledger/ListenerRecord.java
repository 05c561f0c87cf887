package io.relaypay.merchant.ledger;

import java.math.BigInteger;

/**
 * Decoded {@code getListener(address)} tuple of the listener registry.
 *
 * @param stake staked amount in wei
 * @param registeredAt registration time, unix seconds
 * @param totalEarned lifetime rewards in wei
 * @param lastActivityTime last delivery time, unix seconds
 */
public record ListenerRecord(
    String nodeAddress,
    BigInteger stake,
    BigInteger registeredAt,
    BigInteger totalDelivered,
    BigInteger successfulDeliveries,
    BigInteger failedDeliveries,
    BigInteger totalEarned,
    BigInteger reputation,
    boolean active,
    boolean slashed,
    BigInteger lastActivityTime) {}
