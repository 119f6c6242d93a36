package com.storefront.checkout.dto;

import java.util.UUID;

public record CartItemRequest(
        UUID productId,
        Integer quantity
) {}
