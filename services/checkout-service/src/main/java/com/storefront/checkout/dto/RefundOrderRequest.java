package com.storefront.checkout.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * @param amount paise; {@code null} refunds the whole order total
 */
public record RefundOrderRequest(
        @Positive Long amount,
        @Size(max = 255) String reason
) {}
