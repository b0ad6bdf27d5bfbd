package io.fooddelivery.payment;

import java.math.BigDecimal;

/**
 * Charges an amount against a payment instrument.
 *
 * <p>Declines are reported as a {@link GatewayResponse} with failure status. Implementations
 * throw {@link PaymentGatewayException} only when the gateway itself cannot be reached.
 */
public interface PaymentGateway {
    GatewayResponse process(PaymentMethod method, PaymentDetails details, BigDecimal amount);
}
