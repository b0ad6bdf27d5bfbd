package io.fooddelivery.payment;

import java.util.Objects;

public record PaymentMethod(String type) {

    public static final String CREDIT_CARD = "credit_card";
    public static final String PAYPAL = "paypal";

    public PaymentMethod {
        Objects.requireNonNull(type, "type cannot be null");
    }

    public static PaymentMethod creditCard() {
        return new PaymentMethod(CREDIT_CARD);
    }

    public static PaymentMethod paypal() {
        return new PaymentMethod(PAYPAL);
    }

    public static PaymentMethod of(String type) {
        return new PaymentMethod(type);
    }
}
