package io.fooddelivery.order.usecase;

import io.fooddelivery.order.OrderConfirmation;
import io.fooddelivery.order.OrderConfirmedEvent;
import io.fooddelivery.order.OrderEventPublisher;
import io.fooddelivery.profile.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

record PlaceOrderUseCaseImpl(
    UserProfileRepository userProfileRepository,
    OrderEventPublisher orderEventPublisher
) implements PlaceOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(PlaceOrderUseCaseImpl.class);

    PlaceOrderUseCaseImpl {
        Objects.requireNonNull(userProfileRepository, "userProfileRepository cannot be null");
        Objects.requireNonNull(orderEventPublisher, "orderEventPublisher cannot be null");
    }

    @Override
    public OrderConfirmation execute(Input input) {
        var placement = input.placement();
        var confirmation = placement.confirmOrder(input.paymentMethod(), input.paymentDetails());
        if (!(confirmation instanceof OrderConfirmation.Confirmed confirmed)) {
            return confirmation;
        }

        var profile = placement.userProfile();
        userProfileRepository.save(profile);

        // The order stays confirmed even if the event cannot be published.
        var record = placement.confirmedOrder().orElseThrow();
        try {
            orderEventPublisher.publish(OrderConfirmedEvent.from(record, profile.userId(), confirmed.estimatedDelivery()));
        } catch (RuntimeException e) {
            log.warn("EVENT LOST for orderId={}. Order confirmed but OrderConfirmedEvent NOT published. Cause: {}",
                record.orderId(), e.getMessage());
        }
        return confirmed;
    }
}
