package io.relaypay.merchant.dedup;

import java.time.Instant;

public record DuplicateStats(long totalProcessed, Instant oldestEntry) {}
