package io.relaypay.merchant.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.relaypay.merchant.dedup.DuplicateStats;
import java.util.Set;

public record WebhookStats(
    @JsonProperty("duplicates") DuplicateStats duplicates,
    @JsonProperty("active_monitors") Set<String> activeMonitors) {}
