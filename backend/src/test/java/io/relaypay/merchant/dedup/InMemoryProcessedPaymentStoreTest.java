package io.relaypay.merchant.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class InMemoryProcessedPaymentStoreTest {

  @Test
  void putIfAbsent_keepsFirstEntry() {
    var store = new InMemoryProcessedPaymentStore(Duration.ofHours(24), Ticker.systemTicker());
    var first = new ProcessedPayment("0x01", "0xaaa", "0xsig1", Instant.now());
    var second = new ProcessedPayment("0x01", "0xbbb", "0xsig2", Instant.now());

    assertThat(store.putIfAbsent(first)).isSameAs(first);
    assertThat(store.putIfAbsent(second)).isSameAs(first);
    assertThat(store.get("0x01")).contains(first);
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void sweepOlderThan_removesOnlyEntriesBeforeCutoff() {
    var store = new InMemoryProcessedPaymentStore(Duration.ofHours(24), Ticker.systemTicker());
    Instant now = Instant.now();
    store.putIfAbsent(new ProcessedPayment("0xold", "0xaaa", "", now.minus(Duration.ofHours(25))));
    store.putIfAbsent(new ProcessedPayment("0xnew", "0xaaa", "", now.minus(Duration.ofHours(1))));

    int removed = store.sweepOlderThan(now.minus(Duration.ofHours(24)));

    assertThat(removed).isEqualTo(1);
    assertThat(store.has("0xold")).isFalse();
    assertThat(store.has("0xnew")).isTrue();
    assertThat(store.oldestEntry()).contains(now.minus(Duration.ofHours(1)));
  }

  @Test
  void entries_expireAfterRetentionEvenWithoutSweep() {
    var ticker = new FakeTicker();
    var store = new InMemoryProcessedPaymentStore(Duration.ofHours(24), ticker);
    store.putIfAbsent(new ProcessedPayment("0x01", "0xaaa", "", Instant.now()));

    ticker.advance(Duration.ofHours(23));
    assertThat(store.has("0x01")).isTrue();

    ticker.advance(Duration.ofHours(2));
    assertThat(store.has("0x01")).isFalse();
    assertThat(store.size()).isZero();
  }

  /** Fake ticker for simulating time passage in Caffeine caches. */
  private static class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong(System.nanoTime());

    void advance(Duration delta) {
      nanos.addAndGet(delta.toNanos());
    }

    @Override
    public long read() {
      return nanos.get();
    }
  }
}
