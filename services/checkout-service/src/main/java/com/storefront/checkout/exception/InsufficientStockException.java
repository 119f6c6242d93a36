package com.storefront.checkout.exception;

import java.util.List;

public class InsufficientStockException extends CheckoutException {

    public InsufficientStockException(List<String> shortfalls) {
        super(ErrorCode.INSUFFICIENT_STOCK, "Insufficient stock: " + String.join("; ", shortfalls), shortfalls);
    }
}
