package com.storefront.checkout.gateway;

import java.util.List;
import java.util.Map;

/**
 * Port to a payment provider. One implementation per provider; callers select
 * one through {@link PaymentGatewayFactory} by the name stored on the order and
 * never branch on which provider they hold.
 */
public interface PaymentGateway {

    /** Stable identifier, stored on every order placed through this gateway. */
    String name();

    /**
     * Starts a payment with the provider. Performs exactly one provider call and is
     * never retried by callers.
     *
     * @throws com.storefront.checkout.exception.PaymentGatewayException when the call
     *         fails, times out or the provider rejects it
     */
    PaymentRequestResult createPaymentRequest(PaymentOrderContext context);

    /**
     * Confirms the parameters a customer's browser brought back from the provider.
     * Parameters that fail the provider's own authenticity check yield a result with
     * {@code verified == false}.
     */
    VerificationResult verifyPaymentResponse(Map<String, String> payload);

    /** Asks the provider for the current state of the payment tracked under {@code correlationId}. */
    VerificationResult checkStatus(String correlationId);

    /**
     * Returns money for a paid order. A refusal the provider states outright comes
     * back as {@link RefundResult#rejected(String)}; performs at most one provider
     * call and is never retried by callers.
     *
     * @throws com.storefront.checkout.exception.PaymentGatewayException when the call
     *         fails or times out and the outcome is unknown
     */
    RefundResult refund(RefundRequest request);

    /**
     * Checks the provider's signature over the exact bytes received. Must be called
     * before the body is parsed.
     */
    boolean verifyWebhookSignature(byte[] rawBody, String signatureHeader);

    /** Payload fields {@link #verifyPaymentResponse(Map)} cannot work without. */
    List<String> requiredPaymentFields();

    boolean isConfigured();

    /** Public, non-secret values a browser needs to open the provider's checkout. */
    Map<String, Object> clientConfig();
}
