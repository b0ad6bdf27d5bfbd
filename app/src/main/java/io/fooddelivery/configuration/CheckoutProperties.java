package io.fooddelivery.configuration;

import io.fooddelivery.menu.RestaurantMenu;
import io.fooddelivery.order.CheckoutPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Checkout policy and menu.
 * Example (application.yml):
 * checkout:
 *   tax-rate: 0.08
 *   delivery-fee: 5.00
 *   delivery-estimate: 45m
 *   menu-items: [Burger, Pizza, Salad]
 */
@ConfigurationProperties(prefix = "checkout")
public class CheckoutProperties {

    private BigDecimal taxRate = CheckoutPolicy.DEFAULT_TAX_RATE;

    /** Flat fee added to every order. */
    private BigDecimal deliveryFee = CheckoutPolicy.DEFAULT_DELIVERY_FEE;

    /** Offset from confirmation time to the estimated delivery. */
    private Duration deliveryEstimate = CheckoutPolicy.DEFAULT_DELIVERY_ESTIMATE;

    private List<String> menuItems = new ArrayList<>(List.of("Burger", "Pizza", "Salad"));

    public CheckoutPolicy toPolicy() {
        return new CheckoutPolicy(taxRate, deliveryFee, deliveryEstimate);
    }

    public RestaurantMenu toMenu() {
        return new RestaurantMenu(menuItems);
    }

    public BigDecimal getTaxRate() { return taxRate; }
    public void setTaxRate(BigDecimal taxRate) { this.taxRate = taxRate; }
    public BigDecimal getDeliveryFee() { return deliveryFee; }
    public void setDeliveryFee(BigDecimal deliveryFee) { this.deliveryFee = deliveryFee; }
    public Duration getDeliveryEstimate() { return deliveryEstimate; }
    public void setDeliveryEstimate(Duration deliveryEstimate) { this.deliveryEstimate = deliveryEstimate; }
    public List<String> getMenuItems() { return menuItems; }
    public void setMenuItems(List<String> menuItems) { this.menuItems = menuItems; }
}
