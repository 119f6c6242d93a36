package com.storefront.checkout.dto;

import com.storefront.checkout.entity.OrderStatus;

import java.util.UUID;

public record WebhookResult(
        boolean success,
        UUID orderId,
        OrderStatus status
) {
    public static WebhookResult from(PaymentVerificationResult result) {
        return new WebhookResult(true, result.orderId(), result.status());
    }

    public static WebhookResult acknowledged() {
        return new WebhookResult(true, null, null);
    }
}
