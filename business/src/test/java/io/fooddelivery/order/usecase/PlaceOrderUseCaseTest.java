package io.fooddelivery.order.usecase;

import io.fooddelivery.cart.Cart;
import io.fooddelivery.menu.RestaurantMenu;
import io.fooddelivery.order.OrderConfirmation;
import io.fooddelivery.order.OrderConfirmedEvent;
import io.fooddelivery.order.OrderEventPublisher;
import io.fooddelivery.order.OrderPlacement;
import io.fooddelivery.payment.PaymentDetails;
import io.fooddelivery.payment.PaymentMethod;
import io.fooddelivery.profile.UserProfile;
import io.fooddelivery.profile.UserProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class PlaceOrderUseCaseTest {

    private UserProfileRepository userProfileRepository;
    private OrderEventPublisher eventPublisher;
    private PlaceOrderUseCase useCase;

    private Cart cart;
    private UserProfile profile;
    private OrderPlacement placement;

    @BeforeEach
    void setUp() {
        userProfileRepository = mock(UserProfileRepository.class);
        eventPublisher = mock(OrderEventPublisher.class);
        useCase = PlaceOrderUseCase.create(userProfileRepository, eventPublisher);

        cart = new Cart();
        profile = new UserProfile("ana@example.com", "123 Elm St");
        placement = new OrderPlacement(cart, profile, RestaurantMenu.of("Pizza", "Burger"));
    }

    @Test
    void shouldSaveProfileAndPublishEvent() {
        cart.addItem("Pizza", new BigDecimal("10.00"), 2);

        var confirmation = useCase.execute(
            new PlaceOrderUseCase.Input(placement, PaymentMethod.paypal(), PaymentDetails.none()));

        assertThat(confirmation).isInstanceOf(OrderConfirmation.Confirmed.class);
        var orderId = ((OrderConfirmation.Confirmed) confirmation).orderId();
        verify(userProfileRepository).save(profile);
        verify(eventPublisher).publish(argThat(event ->
            event.orderId().equals(orderId)
                && event.userId().equals("ana@example.com")
                && event.items().contains("Pizza")));
    }

    @Test
    void shouldNotSaveOrPublishWhenOrderIsInvalid() {
        var confirmation = useCase.execute(
            new PlaceOrderUseCase.Input(placement, PaymentMethod.paypal(), PaymentDetails.none()));

        assertThat(confirmation.success()).isFalse();
        verify(userProfileRepository, never()).save(any());
        verify(eventPublisher, never()).publish(any());
    }

    @Test
    void shouldKeepConfirmationWhenPublishFails() {
        cart.addItem("Burger", new BigDecimal("8.00"), 1);
        doThrow(new IllegalStateException("broker down")).when(eventPublisher).publish(any(OrderConfirmedEvent.class));

        var confirmation = useCase.execute(
            new PlaceOrderUseCase.Input(placement, PaymentMethod.paypal(), PaymentDetails.none()));

        assertThat(confirmation.success()).isTrue();
        assertThat(profile.orderHistory()).hasSize(1);
        verify(userProfileRepository).save(profile);
    }
}
