package com.storefront.checkout.dto;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Cart contents are checked by the order validator so that every problem is
 * reported at once; only the free-text notes are bounded here.
 */
public record CheckoutRequest(
        List<CartItemRequest> items,
        AddressRequest address,
        @Size(max = 500, message = "Notes must be at most 500 characters") String notes
) {}
