package io.fooddelivery.payment;

import io.fooddelivery.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Validates payment instruments and charges orders through a {@link PaymentGateway}.
 *
 * <p>Card validation only checks field presence and lengths (16-character number,
 * 3-character CVV). A Luhn checksum is applied only when enabled.
 */
public class PaymentProcessing {

    private static final Logger log = LoggerFactory.getLogger(PaymentProcessing.class);

    static final String PAYMENT_SUCCEEDED = "Payment successful, Order confirmed";
    static final String INVALID_METHOD = "Invalid payment method";
    static final String INVALID_CARD = "Invalid credit card details";

    private static final Set<String> SUPPORTED_METHODS = Set.of(PaymentMethod.CREDIT_CARD, PaymentMethod.PAYPAL);

    private final PaymentGateway gateway;
    private final boolean luhnCheck;

    public PaymentProcessing() {
        this(new FakePaymentGateway(), false);
    }

    public PaymentProcessing(PaymentGateway gateway) {
        this(gateway, false);
    }

    public PaymentProcessing(PaymentGateway gateway, boolean luhnCheck) {
        this.gateway = Objects.requireNonNull(gateway, "gateway cannot be null");
        this.luhnCheck = luhnCheck;
    }

    public Set<String> supportedMethods() {
        return SUPPORTED_METHODS;
    }

    public boolean isSupported(PaymentMethod method) {
        return method != null && SUPPORTED_METHODS.contains(method.type());
    }

    public boolean validatePaymentMethod(PaymentMethod method, PaymentDetails details) {
        if (!isSupported(method)) {
            throw new InvalidPaymentException(ErrorKind.INVALID_PAYMENT_METHOD, INVALID_METHOD);
        }
        if (PaymentMethod.CREDIT_CARD.equals(method.type()) && !validateCreditCard(details)) {
            throw new InvalidPaymentException(ErrorKind.INVALID_PAYMENT_DETAILS, INVALID_CARD);
        }
        return true;
    }

    public boolean validateCreditCard(PaymentDetails details) {
        if (details == null
            || isBlank(details.cardNumber())
            || isBlank(details.expiryDate())
            || isBlank(details.cvv())) {
            return false;
        }
        if (details.cardNumber().length() != 16 || details.cvv().length() != 3) {
            return false;
        }
        return !luhnCheck || CardNumbers.passesLuhn(details.cardNumber());
    }

    public PaymentResult processPayment(Payable order, PaymentMethod method, PaymentDetails details) {
        Objects.requireNonNull(order, "order cannot be null");
        if (!isSupported(method)) {
            log.warn("Payment rejected: unsupported method {}", method == null ? null : method.type());
            return new PaymentResult.Failed(ErrorKind.INVALID_PAYMENT_METHOD, "Error: " + INVALID_METHOD);
        }

        var paymentDetails = details == null ? PaymentDetails.none() : details;
        var amount = order.totalAmount();
        GatewayResponse response;
        try {
            response = gateway.process(method, paymentDetails, amount);
        } catch (PaymentGatewayException e) {
            log.warn("Payment gateway unavailable for method={} amount={}: {}", method.type(), amount, e.getMessage());
            return new PaymentResult.Failed(ErrorKind.GATEWAY_UNAVAILABLE, "Payment failed: " + e.getMessage());
        }

        if (response.isSuccess()) {
            log.info("Payment approved method={} amount={} transactionId={}",
                method.type(), amount, response.transactionId());
            return new PaymentResult.Approved(response.transactionId(), PAYMENT_SUCCEEDED);
        }
        log.warn("Payment declined method={} card={} reason={}",
            method.type(), paymentDetails.maskedCardNumber(), response.message());
        return new PaymentResult.Failed(ErrorKind.GATEWAY_DECLINED, "Payment failed: " + response.message());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
