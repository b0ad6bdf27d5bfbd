package io.fooddelivery.order;

import io.fooddelivery.ErrorKind;

import java.util.Objects;

public sealed interface OrderValidation permits OrderValidation.Valid, OrderValidation.Invalid {

    boolean success();

    String message();

    record Valid() implements OrderValidation {
        @Override
        public boolean success() {
            return true;
        }

        @Override
        public String message() {
            return "Order is valid";
        }
    }

    record Invalid(ErrorKind kind, String message) implements OrderValidation {
        public Invalid {
            Objects.requireNonNull(kind, "kind cannot be null");
            Objects.requireNonNull(message, "message cannot be null");
        }

        @Override
        public boolean success() {
            return false;
        }
    }
}
