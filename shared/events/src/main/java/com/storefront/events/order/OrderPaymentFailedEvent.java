package com.storefront.events.order;

import com.storefront.events.OrderLineItem;

import java.util.List;
import java.util.UUID;

public record OrderPaymentFailedEvent(
        UUID orderId,
        UUID userId,
        String gateway,
        String reason,
        boolean stockRestored,
        List<OrderLineItem> items
) {}
