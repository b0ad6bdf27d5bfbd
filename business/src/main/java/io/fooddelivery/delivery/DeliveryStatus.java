package io.fooddelivery.delivery;

import java.util.Optional;

public enum DeliveryStatus {
    PREPARING("Preparing"),
    ON_THE_WAY("On the Way"),
    DELIVERED("Delivered");

    private final String label;

    DeliveryStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public Optional<DeliveryStatus> next() {
        var values = values();
        return ordinal() + 1 < values.length ? Optional.of(values[ordinal() + 1]) : Optional.empty();
    }
}
