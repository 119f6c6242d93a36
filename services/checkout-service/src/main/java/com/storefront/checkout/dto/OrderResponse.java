package com.storefront.checkout.dto;

import com.storefront.checkout.entity.Order;
import com.storefront.checkout.entity.OrderItem;
import com.storefront.checkout.entity.ShippingAddress;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record OrderResponse(
        UUID id,
        UUID userId,
        String status,
        long totalAmount,
        String currency,
        String gateway,
        String merchantTransactionId,
        String gatewayOrderId,
        String gatewayPaymentId,
        AddressResponse shippingAddress,
        List<ItemResponse> items,
        String notes,
        String failureReason,
        Instant shippedAt,
        RefundResponse refund,
        Instant createdAt,
        Instant updatedAt
) {
    public static OrderResponse from(Order order) {
        List<ItemResponse> items = order.getItems().stream()
                .map(ItemResponse::from)
                .toList();
        return new OrderResponse(
                order.getId(),
                order.getUserId(),
                order.getStatus().name(),
                order.getTotalAmount(),
                order.getCurrency(),
                order.getGateway(),
                order.getMerchantTransactionId(),
                order.getGatewayOrderId(),
                order.getGatewayPaymentId(),
                AddressResponse.from(order.getShippingAddress()),
                items,
                order.getNotes(),
                order.getFailureReason(),
                order.getShippedAt(),
                RefundResponse.from(order),
                order.getCreatedAt(),
                order.getUpdatedAt()
        );
    }

    public record ItemResponse(UUID productId, String productName, int quantity, long unitPrice) {
        public static ItemResponse from(OrderItem item) {
            return new ItemResponse(item.getProductId(), item.getProductName(), item.getQuantity(), item.getUnitPrice());
        }
    }

    public record RefundResponse(String refundId, String gatewayRefundId, String status, Long amount,
                                 Instant refundedAt) {
        public static RefundResponse from(Order order) {
            if (!order.hasRefund()) {
                return null;
            }
            return new RefundResponse(order.getRefundId(), order.getGatewayRefundId(),
                    order.getRefundStatus().name(), order.getRefundAmount(), order.getRefundedAt());
        }
    }

    public record AddressResponse(String name, String phone, String line1, String line2,
                                  String city, String state, String pincode) {
        public static AddressResponse from(ShippingAddress address) {
            if (address == null) {
                return null;
            }
            return new AddressResponse(address.getName(), address.getPhone(), address.getLine1(),
                    address.getLine2(), address.getCity(), address.getState(), address.getPincode());
        }
    }
}
