package com.storefront.checkout.gateway;

import com.storefront.checkout.entity.RefundStatus;

/**
 * A provider's definite answer to a refund request. Transport failures, where
 * the outcome is unknown, are raised as exceptions instead.
 */
public record RefundResult(
        RefundStatus status,
        String gatewayRefundId,
        String rawStatus
) {
    public static RefundResult rejected(String rawStatus) {
        return new RefundResult(RefundStatus.REJECTED, null, rawStatus);
    }

    public boolean accepted() {
        return status != RefundStatus.REJECTED;
    }
}
