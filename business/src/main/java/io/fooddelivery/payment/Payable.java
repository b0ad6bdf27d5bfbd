package io.fooddelivery.payment;

import java.math.BigDecimal;

@FunctionalInterface
public interface Payable {
    BigDecimal totalAmount();
}
