package io.fooddelivery.payment;

import io.fooddelivery.BusinessException;
import io.fooddelivery.ErrorKind;

import java.util.Objects;

public class InvalidPaymentException extends BusinessException {

    private final ErrorKind kind;

    public InvalidPaymentException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public ErrorKind kind() {
        return kind;
    }
}
