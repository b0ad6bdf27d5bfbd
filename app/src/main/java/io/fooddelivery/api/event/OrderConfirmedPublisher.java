package io.fooddelivery.api.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fooddelivery.order.OrderConfirmedEvent;
import io.fooddelivery.order.OrderEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes confirmed-order events as JSON to the {@code order.confirmed} log channel,
 * where a downstream collector picks them up.
 */
@Service
public class OrderConfirmedPublisher implements OrderEventPublisher {

    static final String CHANNEL = "order.confirmed";

    private static final Logger events = LoggerFactory.getLogger(CHANNEL);

    private final ObjectMapper objectMapper;

    public OrderConfirmedPublisher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(OrderConfirmedEvent event) {
        try {
            events.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize OrderConfirmedEvent", e);
        }
    }
}
