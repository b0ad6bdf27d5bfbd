package io.fooddelivery.api.checkout;

import io.fooddelivery.order.OrderPlacement;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * One user's checkout flow. Access to the placement, its cart and its profile goes through
 * {@link #read} or {@link #write}; sessions of the same user share one lock.
 */
final class CheckoutSession {

    private final UUID id;
    private final String userId;
    private final ReentrantReadWriteLock lock;
    private OrderPlacement placement;

    CheckoutSession(UUID id, String userId, ReentrantReadWriteLock lock, OrderPlacement placement) {
        this.id = Objects.requireNonNull(id);
        this.userId = Objects.requireNonNull(userId);
        this.lock = Objects.requireNonNull(lock);
        this.placement = Objects.requireNonNull(placement);
    }

    UUID id() {
        return id;
    }

    String userId() {
        return userId;
    }

    <T> T read(Function<OrderPlacement, T> action) {
        lock.readLock().lock();
        try {
            return action.apply(placement);
        } finally {
            lock.readLock().unlock();
        }
    }

    <T> T write(Function<OrderPlacement, T> action) {
        lock.writeLock().lock();
        try {
            return action.apply(placement);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void replacePlacement(OrderPlacement next) {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("write lock required to replace the placement of session " + id);
        }
        this.placement = Objects.requireNonNull(next);
    }
}
