package io.relaypay.merchant.listener;

import io.relaypay.merchant.ledger.ListenerRecord;
import java.math.BigInteger;

/** Registry snapshot of a listener, read fresh for every webhook. Stake is in wei. */
public record ListenerInfo(
    String address,
    BigInteger stake,
    BigInteger reputation,
    boolean active,
    boolean slashed,
    BigInteger totalDelivered,
    BigInteger successfulDeliveries,
    BigInteger failedDeliveries,
    BigInteger lastActivityTime) {

  static ListenerInfo from(String address, ListenerRecord record) {
    return new ListenerInfo(
        address,
        record.stake(),
        record.reputation(),
        record.active(),
        record.slashed(),
        record.totalDelivered(),
        record.successfulDeliveries(),
        record.failedDeliveries(),
        record.lastActivityTime());
  }
}
