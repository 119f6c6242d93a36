package com.storefront.checkout.gateway;

/**
 * What a provider returned when a payment was started. Redirect providers fill
 * {@code paymentUrl}; order-based providers fill {@code gatewayOrderId}.
 */
public record PaymentRequestResult(
        String paymentUrl,
        String transactionId,
        String gatewayOrderId
) {}
