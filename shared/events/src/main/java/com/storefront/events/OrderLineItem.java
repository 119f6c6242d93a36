package com.storefront.events;

import java.util.UUID;

/**
 * Line item as frozen on the order. Amounts are in minor currency units (paise).
 */
public record OrderLineItem(
        UUID productId,
        int quantity,
        long unitPrice
) {}
