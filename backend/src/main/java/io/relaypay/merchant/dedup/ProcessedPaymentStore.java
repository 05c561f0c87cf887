package io.relaypay.merchant.dedup;

import java.time.Instant;
import java.util.Optional;

/**
 * Key-value store behind the duplicate tracker. A single-process map and a shared store are
 * interchangeable as long as {@link #putIfAbsent} is atomic per key.
 */
public interface ProcessedPaymentStore {

  boolean has(String paymentId);

  /**
   * Stores {@code entry} unless the id is already present.
   *
   * @return the entry that is stored for the id after the call
   */
  ProcessedPayment putIfAbsent(ProcessedPayment entry);

  Optional<ProcessedPayment> get(String paymentId);

  /** Removes entries first seen strictly before {@code cutoff}; returns how many were removed. */
  int sweepOlderThan(Instant cutoff);

  long size();

  Optional<Instant> oldestEntry();
}
