package com.storefront.checkout.cart;

import java.util.UUID;

/**
 * The cart service, as far as checkout needs it.
 */
public interface CartClearer {

    void clearCart(UUID userId);
}
