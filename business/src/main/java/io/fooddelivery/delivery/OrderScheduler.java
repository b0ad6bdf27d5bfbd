package io.fooddelivery.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Accepts orders for delivery at a future time. Scheduled order ids have the form {@code SCH1234}.
 *
 * <p>Only pending orders are kept: once an order's delivery time has passed it no longer counts
 * against capacity and its id may be handed out again.
 */
public final class OrderScheduler {

    private static final Logger log = LoggerFactory.getLogger(OrderScheduler.class);

    // SCH1000..SCH9999
    static final int MAX_SCHEDULED_ORDERS = 9000;

    private final Clock clock;
    private final Map<String, ScheduledOrder> pendingOrders = new LinkedHashMap<>();

    public OrderScheduler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public synchronized ScheduleResult schedule(String userId, List<String> items, Instant deliveryTime) {
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(deliveryTime, "deliveryTime cannot be null");
        if (items == null || items.isEmpty()) {
            return new ScheduleResult.Rejected("At least one item is required");
        }
        var now = clock.instant();
        if (!deliveryTime.isAfter(now)) {
            return new ScheduleResult.Rejected("Delivery time must be in the future");
        }
        evictDue(now);
        if (pendingOrders.size() >= MAX_SCHEDULED_ORDERS) {
            return new ScheduleResult.Rejected("No scheduling capacity left");
        }

        var order = new ScheduledOrder(nextOrderId(), userId, items, deliveryTime, now);
        pendingOrders.put(order.orderId(), order);
        log.info("Scheduled order {} for user={} at {}", order.orderId(), userId, deliveryTime);
        return new ScheduleResult.Scheduled(order);
    }

    public synchronized List<ScheduledOrder> scheduledOrders() {
        evictDue(clock.instant());
        return List.copyOf(pendingOrders.values());
    }

    private void evictDue(Instant now) {
        pendingOrders.values().removeIf(order -> !order.scheduledTime().isAfter(now));
    }

    private String nextOrderId() {
        String candidate;
        do {
            candidate = "SCH" + ThreadLocalRandom.current().nextInt(1000, 10000);
        } while (pendingOrders.containsKey(candidate));
        return candidate;
    }
}
