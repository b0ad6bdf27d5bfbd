package io.fooddelivery.order.usecase;

import io.fooddelivery.order.OrderConfirmation;
import io.fooddelivery.order.OrderEventPublisher;
import io.fooddelivery.order.OrderPlacement;
import io.fooddelivery.payment.PaymentDetails;
import io.fooddelivery.payment.PaymentMethod;
import io.fooddelivery.profile.UserProfileRepository;

public sealed interface PlaceOrderUseCase permits PlaceOrderUseCaseImpl {

    static PlaceOrderUseCase create(UserProfileRepository repository, OrderEventPublisher publisher) {
        return new PlaceOrderUseCaseImpl(repository, publisher);
    }

    OrderConfirmation execute(Input input);

    record Input(OrderPlacement placement, PaymentMethod paymentMethod, PaymentDetails paymentDetails) {}
}
