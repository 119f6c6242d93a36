package com.storefront.checkout.webhook;

/**
 * Turns one provider's webhook body into a {@link WebhookNotification}. Only
 * called on bodies whose signature has already been verified.
 */
public interface WebhookAdapter {

    /** Name of the gateway whose deliveries this adapter understands. */
    String gateway();

    /**
     * @throws com.storefront.checkout.exception.ValidationException when the body is
     *         malformed or carries no correlation id
     */
    WebhookNotification normalize(byte[] rawBody);
}
