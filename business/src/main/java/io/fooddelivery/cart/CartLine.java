package io.fooddelivery.cart;

import java.math.BigDecimal;
import java.util.Objects;

public record CartLine(
    String name,
    BigDecimal unitPrice,
    int quantity
) {
    public CartLine {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) throw new IllegalArgumentException("name cannot be blank");
        if (quantity <= 0) throw new IllegalArgumentException("quantity must be positive");
        Objects.requireNonNull(unitPrice, "unitPrice cannot be null");
        if (unitPrice.signum() < 0)
            throw new IllegalArgumentException("unitPrice cannot be negative");
    }

    public BigDecimal subtotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    CartLine merge(BigDecimal latestPrice, int addedQuantity) {
        int merged;
        try {
            merged = Math.addExact(quantity, addedQuantity);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("quantity overflow for " + name + ": " + quantity + " + " + addedQuantity, e);
        }
        return new CartLine(name, latestPrice, merged);
    }

    CartLineView view() {
        return new CartLineView(name, quantity, subtotal());
    }
}
