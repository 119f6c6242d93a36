package com.storefront.checkout.gateway;

import com.storefront.checkout.entity.Order;

import java.util.UUID;

/**
 * @param refundId               merchant-side refund id, unique per refund
 * @param merchantTransactionId  id the original payment was started under
 * @param gatewayPaymentId       provider payment id recorded when the order was paid, may be {@code null}
 * @param amount                 paise, at most the order total
 */
public record RefundRequest(
        UUID orderId,
        UUID userId,
        String refundId,
        String merchantTransactionId,
        String gatewayPaymentId,
        long amount,
        String currency,
        String reason
) {
    public static RefundRequest from(Order order, String refundId, long amount, String reason) {
        return new RefundRequest(
                order.getId(),
                order.getUserId(),
                refundId,
                order.getMerchantTransactionId(),
                order.getGatewayPaymentId(),
                amount,
                order.getCurrency(),
                reason
        );
    }
}
