package com.storefront.checkout.dto;

import jakarta.validation.constraints.Size;

public record CancelOrderRequest(
        @Size(max = 255) String reason
) {}
