package io.fooddelivery.menu;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RestaurantMenuTest {

    @Test
    void shouldReportAvailableItems() {
        var menu = RestaurantMenu.of("Burger", "Pizza", "Salad");

        assertThat(menu.isAvailable("Pizza")).isTrue();
        assertThat(menu.isAvailable("Sushi")).isFalse();
        assertThat(menu.isAvailable(null)).isFalse();
    }

    @Test
    void shouldNotBeAffectedByChangesToSourceList() {
        var items = new ArrayList<>(List.of("Burger"));
        var menu = new RestaurantMenu(items);

        items.add("Pizza");

        assertThat(menu.availableItems()).containsExactly("Burger");
    }
}
