package com.storefront.checkout.entity;

/**
 * Progress of the single refund an order may carry. Kept apart from
 * {@link OrderStatus}: a refunded order stays {@code PAID}.
 */
public enum RefundStatus {
    /** Claimed locally; the provider call is in flight or its outcome is unknown. */
    REQUESTED,
    /** Accepted by the provider, money not yet returned. */
    PENDING,
    PROCESSED,
    /** Refused by the provider. Never stored; the claim is released instead. */
    REJECTED
}
