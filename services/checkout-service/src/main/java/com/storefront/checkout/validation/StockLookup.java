package com.storefront.checkout.validation;

import java.util.Optional;
import java.util.UUID;

@FunctionalInterface
public interface StockLookup {

    /**
     * Units currently available, or empty when the product is unknown.
     */
    Optional<Integer> availableStock(UUID productId);
}
