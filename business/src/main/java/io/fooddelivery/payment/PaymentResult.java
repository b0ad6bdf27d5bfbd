package io.fooddelivery.payment;

import io.fooddelivery.ErrorKind;

import java.util.Objects;

public sealed interface PaymentResult permits PaymentResult.Approved, PaymentResult.Failed {

    boolean success();

    String message();

    record Approved(String transactionId, String message) implements PaymentResult {
        @Override
        public boolean success() {
            return true;
        }
    }

    record Failed(ErrorKind kind, String message) implements PaymentResult {
        public Failed {
            Objects.requireNonNull(kind, "kind cannot be null");
        }

        @Override
        public boolean success() {
            return false;
        }
    }
}
