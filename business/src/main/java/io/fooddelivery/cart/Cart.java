package io.fooddelivery.cart;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Line items of one user session, keyed by item name and kept in insertion order.
 * Not thread-safe; callers sharing a cart must serialize mutations.
 */
public final class Cart {

    private final Map<String, CartLine> lines = new LinkedHashMap<>();

    public String addItem(String name, BigDecimal unitPrice, int quantity) {
        var added = new CartLine(name, unitPrice, quantity);
        var line = lines.merge(name, added,
            (existing, incoming) -> existing.merge(incoming.unitPrice(), incoming.quantity()));
        return "Added " + name + " to cart (quantity: " + line.quantity() + ")";
    }

    public boolean removeItem(String name) {
        return lines.remove(Objects.requireNonNull(name, "name cannot be null")) != null;
    }

    public List<CartLineView> viewCart() {
        return lines.values().stream()
            .map(CartLine::view)
            .toList();
    }

    public List<CartLine> lines() {
        return List.copyOf(lines.values());
    }

    public BigDecimal subtotal() {
        return lines.values().stream()
            .map(CartLine::subtotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int size() {
        return lines.size();
    }

    public void clear() {
        lines.clear();
    }
}
