package io.fooddelivery.payment;

import java.util.Objects;

public record GatewayResponse(Status status, String message, String transactionId) {

    public enum Status { SUCCESS, FAILURE }

    public GatewayResponse {
        Objects.requireNonNull(status, "status cannot be null");
    }

    public static GatewayResponse success(String transactionId) {
        return new GatewayResponse(Status.SUCCESS, null, transactionId);
    }

    public static GatewayResponse failure(String message) {
        return new GatewayResponse(Status.FAILURE, message, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
