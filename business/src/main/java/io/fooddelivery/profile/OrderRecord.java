package io.fooddelivery.profile;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record OrderRecord(
    String orderId,
    List<String> items,
    BigDecimal total,
    Instant placedAt
) {
    public OrderRecord {
        Objects.requireNonNull(orderId, "orderId cannot be null");
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(total, "total cannot be null");
        Objects.requireNonNull(placedAt, "placedAt cannot be null");
        if (total.signum() < 0) throw new IllegalArgumentException("total cannot be negative");
        items = List.copyOf(items);
    }
}
