package io.relaypay.merchant.dedup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.relaypay.merchant.config.DuplicateProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-local store. Entries also expire on their own after the retention window, so a missed
 * sweep never lets the map grow without bound. Not shared between instances.
 */
@Component
public class InMemoryProcessedPaymentStore implements ProcessedPaymentStore {

  private final Cache<String, ProcessedPayment> entries;

  @Autowired
  public InMemoryProcessedPaymentStore(DuplicateProperties properties) {
    this(properties.retention(), Ticker.systemTicker());
  }

  InMemoryProcessedPaymentStore(Duration retention, Ticker ticker) {
    this.entries = Caffeine.newBuilder().expireAfterWrite(retention).ticker(ticker).build();
  }

  @Override
  public boolean has(String paymentId) {
    return entries.getIfPresent(paymentId) != null;
  }

  @Override
  public ProcessedPayment putIfAbsent(ProcessedPayment entry) {
    var existing = entries.asMap().putIfAbsent(entry.paymentId(), entry);
    return existing != null ? existing : entry;
  }

  @Override
  public Optional<ProcessedPayment> get(String paymentId) {
    return Optional.ofNullable(entries.getIfPresent(paymentId));
  }

  @Override
  public int sweepOlderThan(Instant cutoff) {
    var removed = new AtomicInteger();
    entries
        .asMap()
        .values()
        .removeIf(
            entry -> {
              boolean expired = entry.firstSeenAt().isBefore(cutoff);
              if (expired) {
                removed.incrementAndGet();
              }
              return expired;
            });
    entries.cleanUp();
    return removed.get();
  }

  @Override
  public long size() {
    entries.cleanUp();
    return entries.estimatedSize();
  }

  @Override
  public Optional<Instant> oldestEntry() {
    return entries.asMap().values().stream()
        .map(ProcessedPayment::firstSeenAt)
        .min(Comparator.naturalOrder());
  }
}
