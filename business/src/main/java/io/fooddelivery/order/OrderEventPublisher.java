package io.fooddelivery.order;

public interface OrderEventPublisher {
    void publish(OrderConfirmedEvent event);
}
