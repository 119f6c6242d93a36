package com.storefront.checkout.exception;

import com.storefront.checkout.entity.OrderStatus;

import java.util.UUID;

public class InvalidOrderStateException extends CheckoutException {

    private final OrderStatus currentStatus;

    public InvalidOrderStateException(UUID orderId, OrderStatus currentStatus, String operation) {
        super(ErrorCode.INVALID_ORDER_STATE,
                "Order " + orderId + " cannot be " + operation + " in status " + currentStatus);
        this.currentStatus = currentStatus;
    }

    public OrderStatus getCurrentStatus() { return currentStatus; }
}
