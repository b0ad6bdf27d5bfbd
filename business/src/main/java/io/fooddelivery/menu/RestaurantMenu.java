package io.fooddelivery.menu;

import java.util.List;
import java.util.Objects;

public record RestaurantMenu(List<String> availableItems) {

    public RestaurantMenu {
        Objects.requireNonNull(availableItems, "availableItems cannot be null");
        availableItems = List.copyOf(availableItems);
    }

    public static RestaurantMenu of(String... items) {
        return new RestaurantMenu(List.of(items));
    }

    public boolean isAvailable(String itemName) {
        return itemName != null && availableItems.contains(itemName);
    }
}
