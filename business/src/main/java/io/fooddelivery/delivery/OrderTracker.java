package io.fooddelivery.delivery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class OrderTracker {

    public static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofSeconds(10);

    private final String orderId;
    private final Clock clock;
    private final Duration updateInterval;
    private final List<StatusChange> history = new ArrayList<>();

    private DeliveryStatus status = DeliveryStatus.PREPARING;
    private Instant lastUpdate;

    public OrderTracker(String orderId, Clock clock) {
        this(orderId, clock, DEFAULT_UPDATE_INTERVAL);
    }

    public OrderTracker(String orderId, Clock clock, Duration updateInterval) {
        this.orderId = Objects.requireNonNull(orderId, "orderId cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.updateInterval = Objects.requireNonNull(updateInterval, "updateInterval cannot be null");
        this.lastUpdate = clock.instant();
    }

    /**
     * Moves the order to its next stage. Returns false once the order is delivered.
     */
    public boolean advance() {
        var next = status.next();
        if (next.isEmpty()) {
            return false;
        }
        var now = clock.instant();
        history.add(new StatusChange(status, next.get(), now));
        status = next.get();
        lastUpdate = now;
        return true;
    }

    public boolean isFresh() {
        return Duration.between(lastUpdate, clock.instant()).compareTo(updateInterval) <= 0;
    }

    public String orderId() {
        return orderId;
    }

    public DeliveryStatus currentStatus() {
        return status;
    }

    public Instant lastUpdate() {
        return lastUpdate;
    }

    public Duration updateInterval() {
        return updateInterval;
    }

    public List<StatusChange> history() {
        return Collections.unmodifiableList(history);
    }
}
