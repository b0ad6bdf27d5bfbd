package io.fooddelivery;

public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
