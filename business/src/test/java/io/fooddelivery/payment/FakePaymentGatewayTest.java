package io.fooddelivery.payment;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FakePaymentGatewayTest {

    private static final BigDecimal AMOUNT = new BigDecimal("25.00");

    private final FakePaymentGateway gateway = new FakePaymentGateway();

    @Test
    void shouldDeclineReservedCard() {
        var response = gateway.process(PaymentMethod.creditCard(),
            PaymentDetails.card("1111222233334444", "12/25", "123"), AMOUNT);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.message()).isEqualTo("Card declined");
        assertThat(response.transactionId()).isNull();
    }

    @Test
    void shouldApproveOtherCards() {
        var response = gateway.process(PaymentMethod.creditCard(),
            PaymentDetails.card("1234567812345678", "12/25", "123"), AMOUNT);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.transactionId()).startsWith("FAKE-");
    }

    @Test
    void shouldApproveCardPaymentWithoutCardNumber() {
        var response = gateway.process(PaymentMethod.creditCard(), PaymentDetails.none(), AMOUNT);

        assertThat(response.isSuccess()).isTrue();
    }

    @Test
    void shouldAlwaysApprovePaypal() {
        var response = gateway.process(PaymentMethod.paypal(),
            PaymentDetails.card("1111222233334444", null, null), AMOUNT);

        assertThat(response.isSuccess()).isTrue();
    }

    @Test
    void shouldFailUnsupportedMethod() {
        var response = gateway.process(PaymentMethod.of("bitcoin"), PaymentDetails.none(), AMOUNT);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.message()).isEqualTo("Unsupported payment method");
    }

    @Test
    void shouldUseConfiguredDeclinedCards() {
        var custom = new FakePaymentGateway(Set.of("4000000000000002"));

        assertThat(custom.process(PaymentMethod.creditCard(),
            PaymentDetails.card("4000000000000002", "12/25", "123"), AMOUNT).isSuccess()).isFalse();
        assertThat(custom.process(PaymentMethod.creditCard(),
            PaymentDetails.card("1111222233334444", "12/25", "123"), AMOUNT).isSuccess()).isTrue();
    }

    @Test
    void shouldIssueDistinctTransactionIds() {
        var first = gateway.process(PaymentMethod.paypal(), PaymentDetails.none(), AMOUNT);
        var second = gateway.process(PaymentMethod.paypal(), PaymentDetails.none(), AMOUNT);

        assertThat(first.transactionId()).isNotEqualTo(second.transactionId());
    }
}
