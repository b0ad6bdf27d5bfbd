package io.fooddelivery.configuration;

import io.fooddelivery.menu.RestaurantMenu;
import io.fooddelivery.order.CheckoutPolicy;
import io.fooddelivery.order.OrderEventPublisher;
import io.fooddelivery.order.usecase.PlaceOrderUseCase;
import io.fooddelivery.payment.FakePaymentGateway;
import io.fooddelivery.payment.PaymentGateway;
import io.fooddelivery.payment.PaymentProcessing;
import io.fooddelivery.profile.UserProfileRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class UseCaseConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CheckoutPolicy checkoutPolicy(CheckoutProperties properties) {
        return properties.toPolicy();
    }

    @Bean
    public RestaurantMenu restaurantMenu(CheckoutProperties properties) {
        return properties.toMenu();
    }

    @Bean
    @ConditionalOnMissingBean
    public PaymentGateway paymentGateway(PaymentProperties properties) {
        return new FakePaymentGateway(properties.getFake().getDeclinedCards());
    }

    @Bean
    public PaymentProcessing paymentProcessing(PaymentGateway paymentGateway, PaymentProperties properties) {
        return new PaymentProcessing(paymentGateway, properties.isLuhnCheck());
    }

    @Bean
    public PlaceOrderUseCase placeOrderUseCase(UserProfileRepository userProfileRepository,
                                               OrderEventPublisher orderEventPublisher) {
        return PlaceOrderUseCase.create(userProfileRepository, orderEventPublisher);
    }
}
