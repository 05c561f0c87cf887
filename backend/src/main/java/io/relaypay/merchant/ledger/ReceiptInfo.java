package io.relaypay.merchant.ledger;

/** The parts of a transaction receipt the verifiers look at. */
public record ReceiptInfo(
    String transactionHash, long blockNumber, boolean successful, String to) {}
