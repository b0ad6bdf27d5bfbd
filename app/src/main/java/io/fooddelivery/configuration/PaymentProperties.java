package io.fooddelivery.configuration;

import io.fooddelivery.payment.FakePaymentGateway;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.Set;

@ConfigurationProperties(prefix = "payment")
public class PaymentProperties {

    /** Adds a Luhn checksum to credit card validation. */
    private boolean luhnCheck = false;

    private final Fake fake = new Fake();

    public boolean isLuhnCheck() { return luhnCheck; }
    public void setLuhnCheck(boolean luhnCheck) { this.luhnCheck = luhnCheck; }
    public Fake getFake() { return fake; }

    public static class Fake {

        /** Card numbers the fake gateway always declines. */
        private Set<String> declinedCards = new LinkedHashSet<>(Set.of(FakePaymentGateway.DECLINED_CARD));

        public Set<String> getDeclinedCards() { return declinedCards; }
        public void setDeclinedCards(Set<String> declinedCards) { this.declinedCards = declinedCards; }
    }
}
