package com.storefront.checkout.webhook;

import com.storefront.checkout.gateway.VerificationResult;

/**
 * A verified webhook delivery reduced to what settlement needs. Deliveries for
 * events checkout does not act on come back with {@code actionable == false}.
 */
public record WebhookNotification(
        boolean actionable,
        String event,
        String correlationId,
        VerificationResult result
) {
    public static WebhookNotification of(String event, String correlationId, VerificationResult result) {
        return new WebhookNotification(true, event, correlationId, result);
    }

    public static WebhookNotification ignored(String event) {
        return new WebhookNotification(false, event, null, null);
    }
}
