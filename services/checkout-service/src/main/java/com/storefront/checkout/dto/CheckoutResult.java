package com.storefront.checkout.dto;

import java.util.UUID;

public record CheckoutResult(
        UUID orderId,
        String paymentUrl,
        String merchantTransactionId,
        String gatewayOrderId,
        String gateway,
        long amount,
        String currency,
        String receipt
) {}
