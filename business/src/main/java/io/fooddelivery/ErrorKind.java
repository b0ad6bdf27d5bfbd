package io.fooddelivery;

public enum ErrorKind {
    INVALID_ORDER_STATE,
    ORDER_ALREADY_CONFIRMED,
    INVALID_PAYMENT_METHOD,
    INVALID_PAYMENT_DETAILS,
    GATEWAY_DECLINED,
    GATEWAY_UNAVAILABLE;

    /**
     * Input errors can be fixed and retried with the same payment instrument.
     * A decline or an unreachable gateway needs a different instrument or a later attempt.
     */
    public boolean isRetryableWithSameInstrument() {
        return this == INVALID_ORDER_STATE
            || this == INVALID_PAYMENT_DETAILS;
    }
}
