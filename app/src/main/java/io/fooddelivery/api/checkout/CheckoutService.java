package io.fooddelivery.api.checkout;

import io.fooddelivery.BusinessException;
import io.fooddelivery.cart.Cart;
import io.fooddelivery.cart.CartLineView;
import io.fooddelivery.menu.RestaurantMenu;
import io.fooddelivery.order.CheckoutPolicy;
import io.fooddelivery.order.CheckoutState;
import io.fooddelivery.order.CheckoutSummary;
import io.fooddelivery.order.OrderConfirmation;
import io.fooddelivery.order.OrderPlacement;
import io.fooddelivery.order.OrderValidation;
import io.fooddelivery.order.usecase.PlaceOrderUseCase;
import io.fooddelivery.payment.PaymentDetails;
import io.fooddelivery.payment.PaymentMethod;
import io.fooddelivery.payment.PaymentProcessing;
import io.fooddelivery.profile.OrderRecord;
import io.fooddelivery.profile.UserProfile;
import io.fooddelivery.profile.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory checkout sessions for logged-in users.
 *
 * <p>Calls that change a cart, a profile or a placement run under the owning user's write
 * lock. {@link #viewCart} and {@link #orderHistory} only take the read lock.
 * {@link #proceedToCheckout} takes the write lock because it advances the placement state.
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final Map<UUID, CheckoutSession> sessions = new ConcurrentHashMap<>();
    // one entry per user with an open session
    private final Map<String, UserLock> userLocks = new ConcurrentHashMap<>();

    private final UserProfileRepository userProfileRepository;
    private final PlaceOrderUseCase placeOrderUseCase;
    private final PaymentProcessing paymentProcessing;
    private final RestaurantMenu menu;
    private final CheckoutPolicy policy;
    private final Clock clock;

    public CheckoutService(UserProfileRepository userProfileRepository,
                           PlaceOrderUseCase placeOrderUseCase,
                           PaymentProcessing paymentProcessing,
                           RestaurantMenu menu,
                           CheckoutPolicy policy,
                           Clock clock) {
        this.userProfileRepository = Objects.requireNonNull(userProfileRepository);
        this.placeOrderUseCase = Objects.requireNonNull(placeOrderUseCase);
        this.paymentProcessing = Objects.requireNonNull(paymentProcessing);
        this.menu = Objects.requireNonNull(menu);
        this.policy = Objects.requireNonNull(policy);
        this.clock = Objects.requireNonNull(clock);
    }

    public UUID openSession(String userId, String defaultAddress) {
        Objects.requireNonNull(userId, "userId cannot be null");
        var lock = userLocks.compute(userId, (id, current) -> {
            var entry = current == null ? new UserLock() : current;
            entry.openSessions++;
            return entry;
        }).lock;
        UserProfile profile;
        lock.writeLock().lock();
        try {
            profile = userProfileRepository.findById(userId).orElseGet(() -> {
                var created = new UserProfile(userId, defaultAddress);
                userProfileRepository.save(created);
                return created;
            });
        } catch (RuntimeException e) {
            releaseUserLock(userId);
            throw e;
        } finally {
            lock.writeLock().unlock();
        }

        var session = new CheckoutSession(UUID.randomUUID(), userId, lock, newPlacement(new Cart(), profile));
        sessions.put(session.id(), session);
        log.info("Opened checkout session {} for user={}", session.id(), userId);
        return session.id();
    }

    public String addItem(UUID sessionId, String itemName, BigDecimal unitPrice, int quantity) {
        var session = session(sessionId);
        if (!menu.isAvailable(itemName)) {
            throw new BusinessException("Item not on menu: " + itemName);
        }
        return session.write(placement -> placement.cart().addItem(itemName, unitPrice, quantity));
    }

    public boolean removeItem(UUID sessionId, String itemName) {
        return session(sessionId).write(placement -> placement.cart().removeItem(itemName));
    }

    public List<CartLineView> viewCart(UUID sessionId) {
        return session(sessionId).read(placement -> placement.cart().viewCart());
    }

    public boolean changeDeliveryAddress(UUID sessionId, String newAddress) {
        return session(sessionId).write(placement -> {
            var profile = placement.userProfile();
            if (!profile.changeDeliveryAddress(newAddress)) {
                return false;
            }
            userProfileRepository.save(profile);
            return true;
        });
    }

    public void setSpecialInstructions(UUID sessionId, String instructions) {
        session(sessionId).write(placement -> {
            placement.setSpecialInstructions(instructions);
            return null;
        });
    }

    public OrderValidation validateOrder(UUID sessionId) {
        return session(sessionId).write(OrderPlacement::validateOrder);
    }

    public CheckoutSummary proceedToCheckout(UUID sessionId) {
        return session(sessionId).write(OrderPlacement::proceedToCheckout);
    }

    /**
     * Confirms the current order. After a confirmation the session continues with a fresh
     * placement over the same (now empty) cart, even when saving or publishing the confirmed
     * order fails afterwards.
     */
    public OrderConfirmation confirmOrder(UUID sessionId, PaymentMethod method, PaymentDetails details) {
        var session = session(sessionId);
        return session.write(placement -> {
            try {
                return placeOrderUseCase.execute(new PlaceOrderUseCase.Input(placement, method, details));
            } finally {
                if (placement.state() == CheckoutState.CONFIRMED) {
                    session.replacePlacement(newPlacement(placement.cart(), placement.userProfile()));
                }
            }
        });
    }

    public List<OrderRecord> orderHistory(UUID sessionId) {
        return session(sessionId).read(placement -> List.copyOf(placement.userProfile().orderHistory()));
    }

    public boolean closeSession(UUID sessionId) {
        var session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        releaseUserLock(session.userId());
        log.info("Closed checkout session {}", sessionId);
        return true;
    }

    public int activeSessions() {
        return sessions.size();
    }

    int lockedUsers() {
        return userLocks.size();
    }

    private void releaseUserLock(String userId) {
        userLocks.computeIfPresent(userId, (id, entry) -> --entry.openSessions == 0 ? null : entry);
    }

    private OrderPlacement newPlacement(Cart cart, UserProfile profile) {
        return new OrderPlacement(cart, profile, menu, policy, paymentProcessing, clock);
    }

    private CheckoutSession session(UUID sessionId) {
        var session = sessions.get(sessionId);
        if (session == null) {
            throw new BusinessException("Session not found: " + sessionId);
        }
        return session;
    }

    private static final class UserLock {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private int openSessions;
    }
}
