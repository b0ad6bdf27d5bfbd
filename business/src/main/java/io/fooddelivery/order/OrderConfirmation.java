package io.fooddelivery.order;

import io.fooddelivery.ErrorKind;

import java.time.Instant;
import java.util.Objects;

public sealed interface OrderConfirmation permits OrderConfirmation.Confirmed, OrderConfirmation.Rejected {

    boolean success();

    String message();

    record Confirmed(String orderId, Instant estimatedDelivery, String message) implements OrderConfirmation {
        public Confirmed {
            Objects.requireNonNull(orderId, "orderId cannot be null");
            Objects.requireNonNull(estimatedDelivery, "estimatedDelivery cannot be null");
        }

        @Override
        public boolean success() {
            return true;
        }
    }

    record Rejected(ErrorKind kind, String message) implements OrderConfirmation {
        public Rejected {
            Objects.requireNonNull(kind, "kind cannot be null");
        }

        @Override
        public boolean success() {
            return false;
        }
    }
}
