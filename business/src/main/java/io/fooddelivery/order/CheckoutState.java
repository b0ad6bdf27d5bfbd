package io.fooddelivery.order;

public enum CheckoutState {
    OPEN,
    VALIDATED,
    CHECKED_OUT,
    CONFIRMED
}
