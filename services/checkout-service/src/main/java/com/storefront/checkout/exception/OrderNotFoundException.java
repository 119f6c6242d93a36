package com.storefront.checkout.exception;

public class OrderNotFoundException extends CheckoutException {

    public OrderNotFoundException(Object reference) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + reference);
    }
}
