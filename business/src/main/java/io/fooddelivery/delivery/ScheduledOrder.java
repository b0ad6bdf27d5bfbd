package io.fooddelivery.delivery;

import java.time.Instant;
import java.util.List;

public record ScheduledOrder(
    String orderId,
    String userId,
    List<String> items,
    Instant scheduledTime,
    Instant createdAt
) {
    public ScheduledOrder {
        items = List.copyOf(items);
    }
}
