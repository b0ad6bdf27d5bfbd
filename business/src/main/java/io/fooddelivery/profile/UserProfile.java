package io.fooddelivery.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class UserProfile {

    private final String userId;
    private String deliveryAddress;
    private final List<OrderRecord> orderHistory = new ArrayList<>();

    public UserProfile(String userId, String deliveryAddress) {
        this.userId = Objects.requireNonNull(userId, "userId cannot be null");
        this.deliveryAddress = deliveryAddress == null ? "" : deliveryAddress;
    }

    public String userId() {
        return userId;
    }

    public String deliveryAddress() {
        return deliveryAddress;
    }

    public boolean hasDeliveryAddress() {
        return !deliveryAddress.isBlank();
    }

    /**
     * Replaces the delivery address. Blank input is refused and leaves the current address in place.
     */
    public boolean changeDeliveryAddress(String newAddress) {
        if (newAddress == null || newAddress.isBlank()) {
            return false;
        }
        this.deliveryAddress = newAddress.strip();
        return true;
    }

    public List<OrderRecord> orderHistory() {
        return Collections.unmodifiableList(orderHistory);
    }

    public void recordOrder(OrderRecord record) {
        orderHistory.add(Objects.requireNonNull(record, "record cannot be null"));
    }
}
