package io.relaypay.merchant.listener;

import java.math.BigDecimal;
import java.time.Instant;

/** Human-readable listener statistics. Amounts are in ETH, success rate in percent. */
public record ListenerStats(
    String address,
    boolean active,
    boolean slashed,
    BigDecimal stake,
    String reputation,
    Instant registeredAt,
    String totalDelivered,
    String successfulDeliveries,
    String failedDeliveries,
    BigDecimal totalEarned,
    String successRate) {}
