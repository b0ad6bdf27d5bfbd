package io.fooddelivery.order;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed pricing and delivery constants applied at checkout.
 * Tax is rounded half-up to cents; the delivery fee is flat.
 */
public record CheckoutPolicy(
    BigDecimal taxRate,
    BigDecimal deliveryFee,
    Duration deliveryEstimate
) {
    public static final BigDecimal DEFAULT_TAX_RATE = new BigDecimal("0.08");
    public static final BigDecimal DEFAULT_DELIVERY_FEE = new BigDecimal("5.00");
    public static final Duration DEFAULT_DELIVERY_ESTIMATE = Duration.ofMinutes(45);

    public CheckoutPolicy {
        Objects.requireNonNull(taxRate, "taxRate cannot be null");
        Objects.requireNonNull(deliveryFee, "deliveryFee cannot be null");
        Objects.requireNonNull(deliveryEstimate, "deliveryEstimate cannot be null");
        if (taxRate.signum() < 0) throw new IllegalArgumentException("taxRate cannot be negative");
        if (deliveryFee.signum() < 0) throw new IllegalArgumentException("deliveryFee cannot be negative");
        if (deliveryEstimate.isNegative())
            throw new IllegalArgumentException("deliveryEstimate cannot be negative");
    }

    public static CheckoutPolicy defaults() {
        return new CheckoutPolicy(DEFAULT_TAX_RATE, DEFAULT_DELIVERY_FEE, DEFAULT_DELIVERY_ESTIMATE);
    }

    public TotalsBreakdown totalsFor(BigDecimal subtotal) {
        Objects.requireNonNull(subtotal, "subtotal cannot be null");
        if (subtotal.signum() < 0) throw new IllegalArgumentException("subtotal cannot be negative");
        var tax = subtotal.multiply(taxRate).setScale(2, RoundingMode.HALF_UP);
        return TotalsBreakdown.of(subtotal, tax, deliveryFee);
    }

    public Instant estimateDelivery(Instant confirmedAt) {
        return confirmedAt.plus(deliveryEstimate);
    }
}
