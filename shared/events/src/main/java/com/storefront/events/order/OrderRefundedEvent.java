package com.storefront.events.order;

import java.util.UUID;

/**
 * A refund was accepted by the payment provider. {@code refundStatus} is
 * {@code PENDING} while the provider is still moving the money.
 */
public record OrderRefundedEvent(
        UUID orderId,
        UUID userId,
        String refundId,
        String gatewayRefundId,
        long amount,
        String currency,
        String gateway,
        String refundStatus,
        String reason
) {}
