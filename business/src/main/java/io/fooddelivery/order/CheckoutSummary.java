package io.fooddelivery.order;

import io.fooddelivery.cart.CartLineView;
import io.fooddelivery.payment.Payable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

public record CheckoutSummary(
    List<CartLineView> items,
    TotalsBreakdown totalInfo,
    String deliveryAddress,
    String specialInstructions
) implements Payable {

    public CheckoutSummary {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(totalInfo, "totalInfo cannot be null");
        items = List.copyOf(items);
    }

    @Override
    public BigDecimal totalAmount() {
        return totalInfo.total();
    }
}
