package com.storefront.events.order;

import java.util.UUID;

public record OrderPaidEvent(
        UUID orderId,
        UUID userId,
        long totalAmount,
        String currency,
        String gateway,
        String gatewayPaymentId
) {}
