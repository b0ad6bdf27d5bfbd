package io.fooddelivery.delivery;

import java.time.Instant;

public record StatusChange(DeliveryStatus from, DeliveryStatus to, Instant at) {}
