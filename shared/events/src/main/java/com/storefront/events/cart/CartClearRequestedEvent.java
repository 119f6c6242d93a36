package com.storefront.events.cart;

import java.util.UUID;

public record CartClearRequestedEvent(
        UUID userId
) {}
