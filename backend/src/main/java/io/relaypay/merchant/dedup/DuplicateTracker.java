package io.relaypay.merchant.dedup;

import io.relaypay.merchant.config.DuplicateProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Anti-replay guard keyed by payment id. The first delivery to be marked becomes the canonical one;
 * every later claim for the same id sees the mark until the entry is swept after the retention
 * window.
 */
@Service
public class DuplicateTracker {

  private static final Logger log = LoggerFactory.getLogger(DuplicateTracker.class);

  private final ProcessedPaymentStore store;
  private final Duration retention;
  private final Clock clock;

  @Autowired
  public DuplicateTracker(ProcessedPaymentStore store, DuplicateProperties properties) {
    this(store, properties, Clock.systemUTC());
  }

  DuplicateTracker(ProcessedPaymentStore store, DuplicateProperties properties, Clock clock) {
    this.store = store;
    this.retention = properties.retention();
    this.clock = clock;
  }

  public boolean isProcessed(String paymentId) {
    return store.has(paymentId);
  }

  /**
   * Records the delivery of {@code paymentId}.
   *
   * @return true if this call created the canonical entry, false if another delivery got there
   *     first
   */
  public boolean markProcessed(String paymentId, String listenerAddress, String signature) {
    var candidate =
        new ProcessedPayment(
            paymentId, listenerAddress, signature != null ? signature : "", clock.instant());
    var stored = store.putIfAbsent(candidate);
    if (stored != candidate) {
      log.debug(
          "Payment {} already marked as processed by {}, skipping",
          paymentId,
          stored.listenerAddress());
      return false;
    }
    log.info("Marked payment {} as processed by {}", paymentId, listenerAddress);
    return true;
  }

  public Optional<ProcessedPayment> getOriginal(String paymentId) {
    return store.get(paymentId);
  }

  public DuplicateStats stats() {
    return new DuplicateStats(store.size(), store.oldestEntry().orElse(null));
  }

  @Scheduled(fixedRate = 3600000) // hourly
  public void sweep() {
    Instant cutoff = clock.instant().minus(retention);
    int removed = store.sweepOlderThan(cutoff);
    if (removed > 0) {
      log.info("Evicted {} processed payment entries older than {}", removed, cutoff);
    }
  }
}
