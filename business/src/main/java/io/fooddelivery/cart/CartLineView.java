package io.fooddelivery.cart;

import java.math.BigDecimal;

public record CartLineView(String name, int quantity, BigDecimal subtotal) {}
