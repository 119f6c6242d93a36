package com.storefront.events.serde;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.storefront.events.EventTypes;
import com.storefront.events.cart.CartClearRequestedEvent;
import com.storefront.events.order.OrderCancelledEvent;
import com.storefront.events.order.OrderPaidEvent;
import com.storefront.events.order.OrderPaymentFailedEvent;
import com.storefront.events.order.OrderRefundedEvent;

public final class EventObjectMapper {

    private static final ObjectMapper INSTANCE;

    static {
        INSTANCE = new ObjectMapper();
        INSTANCE.registerModule(new JavaTimeModule());
        INSTANCE.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        INSTANCE.registerSubtypes(
                new NamedType(OrderPaidEvent.class, EventTypes.ORDER_PAID),
                new NamedType(OrderPaymentFailedEvent.class, EventTypes.ORDER_PAYMENT_FAILED),
                new NamedType(OrderCancelledEvent.class, EventTypes.ORDER_CANCELLED),
                new NamedType(OrderRefundedEvent.class, EventTypes.ORDER_REFUNDED),
                new NamedType(CartClearRequestedEvent.class, EventTypes.CART_CLEAR_REQUESTED)
        );
    }

    private EventObjectMapper() {}

    public static ObjectMapper instance() {
        return INSTANCE;
    }
}
