package io.fooddelivery.order;

import java.math.BigDecimal;
import java.util.Objects;

public record TotalsBreakdown(
    BigDecimal subtotal,
    BigDecimal tax,
    BigDecimal deliveryFee,
    BigDecimal total
) {
    public TotalsBreakdown {
        requireNonNegative(subtotal, "subtotal");
        requireNonNegative(tax, "tax");
        requireNonNegative(deliveryFee, "deliveryFee");
        requireNonNegative(total, "total");
        if (total.compareTo(subtotal.add(tax).add(deliveryFee)) != 0)
            throw new IllegalArgumentException("total must equal subtotal + tax + deliveryFee");
    }

    public static TotalsBreakdown of(BigDecimal subtotal, BigDecimal tax, BigDecimal deliveryFee) {
        Objects.requireNonNull(subtotal, "subtotal cannot be null");
        Objects.requireNonNull(tax, "tax cannot be null");
        Objects.requireNonNull(deliveryFee, "deliveryFee cannot be null");
        return new TotalsBreakdown(subtotal, tax, deliveryFee, subtotal.add(tax).add(deliveryFee));
    }

    private static void requireNonNegative(BigDecimal value, String field) {
        Objects.requireNonNull(value, field + " cannot be null");
        if (value.signum() < 0) throw new IllegalArgumentException(field + " cannot be negative");
    }
}
