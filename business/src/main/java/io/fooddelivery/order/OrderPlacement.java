package io.fooddelivery.order;

import io.fooddelivery.ErrorKind;
import io.fooddelivery.cart.Cart;
import io.fooddelivery.cart.CartLineView;
import io.fooddelivery.menu.RestaurantMenu;
import io.fooddelivery.payment.InvalidPaymentException;
import io.fooddelivery.payment.PaymentDetails;
import io.fooddelivery.payment.PaymentMethod;
import io.fooddelivery.payment.PaymentProcessing;
import io.fooddelivery.payment.PaymentResult;
import io.fooddelivery.profile.OrderRecord;
import io.fooddelivery.profile.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one checkout attempt over a cart and a user profile.
 *
 * <p>Validation and checkout may be repeated while the cart changes. A successful
 * confirmation records the order in the profile history, clears the cart and moves the
 * placement to {@link CheckoutState#CONFIRMED}; every later confirmation is rejected.
 * Failed confirmations leave the placement open for another attempt.
 */
public final class OrderPlacement {

    private static final Logger log = LoggerFactory.getLogger(OrderPlacement.class);

    static final String CONFIRMED_MESSAGE = "Order confirmed";

    private final Cart cart;
    private final UserProfile userProfile;
    private final RestaurantMenu menu;
    private final CheckoutPolicy policy;
    private final PaymentProcessing paymentProcessing;
    private final Clock clock;

    private String specialInstructions = "";
    private CheckoutState state = CheckoutState.OPEN;
    private OrderRecord confirmedOrder;

    public OrderPlacement(Cart cart, UserProfile userProfile, RestaurantMenu menu) {
        this(cart, userProfile, menu, CheckoutPolicy.defaults(), null, Clock.systemUTC());
    }

    public OrderPlacement(Cart cart, UserProfile userProfile, RestaurantMenu menu,
                          CheckoutPolicy policy, PaymentProcessing paymentProcessing, Clock clock) {
        this.cart = Objects.requireNonNull(cart, "cart cannot be null");
        this.userProfile = Objects.requireNonNull(userProfile, "userProfile cannot be null");
        this.menu = Objects.requireNonNull(menu, "menu cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.paymentProcessing = paymentProcessing;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public OrderValidation validateOrder() {
        var validation = check();
        if (state != CheckoutState.CONFIRMED) {
            state = validation.success() ? CheckoutState.VALIDATED : CheckoutState.OPEN;
        }
        return validation;
    }

    public CheckoutSummary proceedToCheckout() {
        var summary = new CheckoutSummary(
            cart.viewCart(),
            policy.totalsFor(cart.subtotal()),
            userProfile.deliveryAddress(),
            specialInstructions);
        if (state != CheckoutState.CONFIRMED) {
            state = CheckoutState.CHECKED_OUT;
        }
        return summary;
    }

    public OrderConfirmation confirmOrder(PaymentMethod paymentMethod) {
        return confirmOrder(paymentMethod, PaymentDetails.none());
    }

    public OrderConfirmation confirmOrder(PaymentMethod paymentMethod, PaymentDetails paymentDetails) {
        Objects.requireNonNull(paymentMethod, "paymentMethod cannot be null");
        var details = paymentDetails == null ? PaymentDetails.none() : paymentDetails;

        if (check() instanceof OrderValidation.Invalid invalid) {
            if (state != CheckoutState.CONFIRMED) {
                state = CheckoutState.OPEN;
            }
            log.warn("Order confirmation rejected for user={}: {}", userProfile.userId(), invalid.message());
            return new OrderConfirmation.Rejected(invalid.kind(), invalid.message());
        }

        var summary = proceedToCheckout();
        if (paymentProcessing != null) {
            var rejection = authorizePayment(summary, paymentMethod, details);
            if (rejection.isPresent()) {
                return rejection.get();
            }
        }

        var now = clock.instant();
        var items = summary.items().stream()
            .map(CartLineView::name)
            .toList();
        var record = new OrderRecord(UUID.randomUUID().toString(), items, summary.totalAmount(), now);
        userProfile.recordOrder(record);
        cart.clear();
        confirmedOrder = record;
        state = CheckoutState.CONFIRMED;

        log.info("Order {} confirmed for user={} total={}", record.orderId(), userProfile.userId(), record.total());
        return new OrderConfirmation.Confirmed(record.orderId(), policy.estimateDelivery(now), CONFIRMED_MESSAGE);
    }

    private Optional<OrderConfirmation> authorizePayment(CheckoutSummary summary,
                                                         PaymentMethod method,
                                                         PaymentDetails details) {
        try {
            paymentProcessing.validatePaymentMethod(method, details);
        } catch (InvalidPaymentException e) {
            log.warn("Payment validation failed for user={}: {}", userProfile.userId(), e.getMessage());
            return Optional.of(new OrderConfirmation.Rejected(e.kind(), e.getMessage()));
        }
        var result = paymentProcessing.processPayment(summary, method, details);
        if (result instanceof PaymentResult.Failed failed) {
            return Optional.of(new OrderConfirmation.Rejected(failed.kind(), failed.message()));
        }
        return Optional.empty();
    }

    private OrderValidation check() {
        if (state == CheckoutState.CONFIRMED) {
            return new OrderValidation.Invalid(ErrorKind.ORDER_ALREADY_CONFIRMED, "Order already confirmed");
        }
        if (cart.isEmpty()) {
            return new OrderValidation.Invalid(ErrorKind.INVALID_ORDER_STATE, "Cart is empty");
        }
        if (!userProfile.hasDeliveryAddress()) {
            return new OrderValidation.Invalid(ErrorKind.INVALID_ORDER_STATE, "Delivery address is required");
        }
        return new OrderValidation.Valid();
    }

    public String specialInstructions() {
        return specialInstructions;
    }

    public void setSpecialInstructions(String specialInstructions) {
        this.specialInstructions = specialInstructions == null ? "" : specialInstructions;
    }

    public CheckoutState state() {
        return state;
    }

    public Optional<OrderRecord> confirmedOrder() {
        return Optional.ofNullable(confirmedOrder);
    }

    public Cart cart() {
        return cart;
    }

    public UserProfile userProfile() {
        return userProfile;
    }

    public RestaurantMenu menu() {
        return menu;
    }
}
