package com.storefront.checkout.dto;

import com.storefront.checkout.entity.Order;
import com.storefront.checkout.entity.OrderStatus;

import java.util.UUID;

/**
 * Outcome of a verification, status poll or webhook. {@code success} means the
 * order has reached a terminal status; a repeated call on a settled order is
 * reported with {@code alreadyProcessed} set rather than as an error.
 */
public record PaymentVerificationResult(
        boolean success,
        UUID orderId,
        OrderStatus status,
        String gateway,
        boolean alreadyProcessed,
        String message
) {
    public static PaymentVerificationResult settled(Order order, OrderStatus status) {
        return new PaymentVerificationResult(true, order.getId(), status, order.getGateway(), false,
                "Payment " + (status == OrderStatus.PAID ? "confirmed" : "failed"));
    }

    public static PaymentVerificationResult alreadyProcessed(Order order) {
        return new PaymentVerificationResult(true, order.getId(), order.getStatus(), order.getGateway(), true,
                "Order already " + order.getStatus().name().toLowerCase());
    }

    public static PaymentVerificationResult pending(Order order, String message) {
        return new PaymentVerificationResult(false, order.getId(), order.getStatus(), order.getGateway(), false,
                message);
    }
}
