package io.relaypay.merchant.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.relaypay.merchant.order.OrderStatus;

public record OrderView(
    @JsonProperty("order_id") String orderId,
    OrderStatus status,
    @JsonProperty("processed_at") long processedAt) {}
