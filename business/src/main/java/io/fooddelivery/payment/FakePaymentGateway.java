package io.fooddelivery.payment;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Deterministic stand-in for a real gateway.
 * Cards in the declined set fail with "Card declined"; other cards and PayPal succeed.
 */
public final class FakePaymentGateway implements PaymentGateway {

    public static final String DECLINED_CARD = "1111222233334444";

    private final Set<String> declinedCards;

    public FakePaymentGateway() {
        this(Set.of(DECLINED_CARD));
    }

    public FakePaymentGateway(Set<String> declinedCards) {
        this.declinedCards = Set.copyOf(Objects.requireNonNull(declinedCards, "declinedCards cannot be null"));
    }

    @Override
    public GatewayResponse process(PaymentMethod method, PaymentDetails details, BigDecimal amount) {
        return switch (method.type()) {
            case PaymentMethod.CREDIT_CARD -> isDeclined(details)
                ? GatewayResponse.failure("Card declined")
                : GatewayResponse.success(transactionId());
            case PaymentMethod.PAYPAL -> GatewayResponse.success(transactionId());
            default -> GatewayResponse.failure("Unsupported payment method");
        };
    }

    private boolean isDeclined(PaymentDetails details) {
        return details != null
            && details.cardNumber() != null
            && declinedCards.contains(details.cardNumber());
    }

    private static String transactionId() {
        return "FAKE-" + UUID.randomUUID();
    }
}
