package io.fooddelivery.api.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.fooddelivery.order.OrderConfirmedEvent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OrderConfirmedPublisherTest {

    private final OrderConfirmedEvent event = new OrderConfirmedEvent(
        UUID.randomUUID(), "order-1", "ana@example.com", List.of("Pizza"),
        new BigDecimal("26.60"), Instant.parse("2026-03-01T18:45:00Z"), Instant.parse("2026-03-01T18:00:00Z"));

    @Test
    void shouldSerializeEvent() {
        var publisher = new OrderConfirmedPublisher(new ObjectMapper().registerModule(new JavaTimeModule()));

        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();
    }

    @Test
    void shouldFailWhenEventCannotBeSerialized() throws Exception {
        var objectMapper = mock(ObjectMapper.class);
        when(objectMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") {});
        var publisher = new OrderConfirmedPublisher(objectMapper);

        assertThatThrownBy(() -> publisher.publish(event))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to serialize OrderConfirmedEvent");
    }
}
