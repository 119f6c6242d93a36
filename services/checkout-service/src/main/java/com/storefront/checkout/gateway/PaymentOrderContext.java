package com.storefront.checkout.gateway;

import com.storefront.checkout.entity.Order;

import java.util.UUID;

public record PaymentOrderContext(
        UUID orderId,
        UUID userId,
        long amount,
        String currency,
        String merchantTransactionId,
        String receipt,
        String customerName,
        String customerEmail,
        String customerPhone
) {
    public static PaymentOrderContext from(Order order) {
        var address = order.getShippingAddress();
        return new PaymentOrderContext(
                order.getId(),
                order.getUserId(),
                order.getTotalAmount(),
                order.getCurrency(),
                order.getMerchantTransactionId(),
                order.getReceipt(),
                address.getName(),
                address.getEmail(),
                address.getPhone()
        );
    }
}
