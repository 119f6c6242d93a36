package com.storefront.checkout.exception;

import com.storefront.checkout.entity.OrderStatus;

import java.util.UUID;

public class OrderNotCancellableException extends InvalidOrderStateException {

    public OrderNotCancellableException(UUID orderId, OrderStatus currentStatus, boolean shipped) {
        super(orderId, currentStatus, shipped ? "cancelled after shipment" : "cancelled");
    }
}
