package com.storefront.events.order;

import com.storefront.events.OrderLineItem;

import java.util.List;
import java.util.UUID;

public record OrderCancelledEvent(
        UUID orderId,
        String reason,
        List<OrderLineItem> items
) {}
