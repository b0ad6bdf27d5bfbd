package io.fooddelivery.order;

import io.fooddelivery.profile.OrderRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record OrderConfirmedEvent(
    UUID eventId,
    String orderId,
    String userId,
    List<String> items,
    BigDecimal totalAmount,
    Instant estimatedDelivery,
    Instant occurredAt
) {
    public static OrderConfirmedEvent from(OrderRecord record, String userId, Instant estimatedDelivery) {
        return new OrderConfirmedEvent(
            UUID.randomUUID(), record.orderId(), userId,
            record.items(), record.total(), estimatedDelivery, record.placedAt());
    }
}
