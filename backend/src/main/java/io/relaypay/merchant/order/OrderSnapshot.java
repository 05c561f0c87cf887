package io.relaypay.merchant.order;

import java.math.BigDecimal;

/** The fields of a stored order that payment processing reads. */
public record OrderSnapshot(
    String orderId, OrderStatus status, String customerEmail, BigDecimal totalAmount) {}
