package com.storefront.events;

public final class EventTypes {
    private EventTypes() {}

    public static final String ORDER_PAID = "OrderPaid";
    public static final String ORDER_PAYMENT_FAILED = "OrderPaymentFailed";
    public static final String ORDER_CANCELLED = "OrderCancelled";
    public static final String ORDER_REFUNDED = "OrderRefunded";

    public static final String CART_CLEAR_REQUESTED = "CartClearRequested";
}
