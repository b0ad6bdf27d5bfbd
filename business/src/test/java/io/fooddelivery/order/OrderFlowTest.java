package io.fooddelivery.order;

import io.fooddelivery.cart.Cart;
import io.fooddelivery.menu.RestaurantMenu;
import io.fooddelivery.payment.PaymentDetails;
import io.fooddelivery.payment.PaymentMethod;
import io.fooddelivery.payment.PaymentProcessing;
import io.fooddelivery.profile.UserProfile;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class OrderFlowTest {

    private final RestaurantMenu menu = RestaurantMenu.of("Burger", "Pizza", "Salad");

    @Test
    void emptyCartFailsValidation() {
        var placement = new OrderPlacement(new Cart(), new UserProfile("u1", "123 Main St"), menu);

        assertThat(placement.validateOrder().success()).isFalse();
    }

    @Test
    void checkoutTotalsSingleLine() {
        var cart = new Cart();
        cart.addItem("Burger", new BigDecimal("8.0"), 2);
        var placement = new OrderPlacement(cart, new UserProfile("u1", "123 Main St"), menu);

        var totals = placement.proceedToCheckout().totalInfo();

        assertThat(totals.subtotal()).isEqualByComparingTo("16.0");
        assertThat(totals.total()).isEqualByComparingTo(totals.subtotal().add(totals.tax()).add(totals.deliveryFee()));
    }

    @Test
    void declinedCardFailsPayment() {
        var result = new PaymentProcessing().processPayment(() -> new BigDecimal("100.0"),
            PaymentMethod.creditCard(), PaymentDetails.card("1111222233334444", "12/25", "123"));

        assertThat(result.message()).isEqualTo("Payment failed: Card declined");
    }

    @Test
    void unsupportedMethodFailsPayment() {
        var result = new PaymentProcessing().processPayment(() -> new BigDecimal("50.0"),
            PaymentMethod.of("bitcoin"), PaymentDetails.none());

        assertThat(result.message()).isEqualTo("Error: Invalid payment method");
    }

    @Test
    void removedItemLeavesEmptyCart() {
        var cart = new Cart();
        cart.addItem("Pizza", new BigDecimal("10.0"), 2);
        cart.removeItem("Pizza");

        assertThat(cart.viewCart()).isEmpty();
    }

    @Test
    void fullOrderFlowRecordsHistory() {
        var cart = new Cart();
        var user = new UserProfile("u1", "123 Elm St");
        var placement = new OrderPlacement(cart, user, menu);
        cart.addItem("Pizza", new BigDecimal("10.0"), 2);

        assertThat(placement.validateOrder().success()).isTrue();
        var summary = placement.proceedToCheckout();
        var result = placement.confirmOrder(PaymentMethod.of("unspecified"));

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("Order confirmed");
        assertThat(user.orderHistory()).singleElement()
            .satisfies(record -> assertThat(record.total()).isEqualByComparingTo(summary.totalInfo().total()));
    }
}
