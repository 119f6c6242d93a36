package com.storefront.checkout.cart;

import com.storefront.checkout.outbox.OutboxWriter;
import com.storefront.events.EventTypes;
import com.storefront.events.cart.CartClearRequestedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Asks the cart service to empty a cart by publishing {@code CartClearRequested}
 * on the cart topic.
 */
@Component
public class OutboxCartClearer implements CartClearer {

    private static final Logger log = LoggerFactory.getLogger(OutboxCartClearer.class);

    private final OutboxWriter outboxWriter;

    public OutboxCartClearer(OutboxWriter outboxWriter) {
        this.outboxWriter = outboxWriter;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void clearCart(UUID userId) {
        outboxWriter.append(OutboxWriter.CART_AGGREGATE, userId, EventTypes.CART_CLEAR_REQUESTED,
                new CartClearRequestedEvent(userId));
        log.info("Cart clear requested for user {}", userId);
    }
}
