package com.storefront.checkout.service;

import com.storefront.checkout.entity.OrderStatus;
import com.storefront.checkout.gateway.VerificationResult;
import com.storefront.checkout.gateway.phonepe.PhonePeGateway;
import com.storefront.checkout.gateway.razorpay.RazorpayGateway;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Decides the order status a provider answer leads to. This is the only place
 * that knows which provider codes mean "not finished yet".
 */
@Component
public class PaymentVerifier {

    private static final Map<String, Set<String>> PENDING_STATES = Map.of(
            PhonePeGateway.NAME, Set.of("PAYMENT_PENDING", "PAYMENT_INITIATED"),
            RazorpayGateway.NAME, Set.of("created", "attempted", "authorized")
    );

    /**
     * @return {@link OrderStatus#PAID}, {@link OrderStatus#FAILED}, or
     *         {@link OrderStatus#PENDING} when no transition should be applied
     */
    public OrderStatus determineStatus(String gateway, VerificationResult result) {
        if (!result.verified()) {
            return OrderStatus.PENDING;
        }
        if (result.success()) {
            return OrderStatus.PAID;
        }
        // a verified answer that names no provider code reports nothing final
        if (result.rawStatus() == null || result.rawStatus().isBlank()) {
            return OrderStatus.PENDING;
        }
        if (PENDING_STATES.getOrDefault(gateway, Set.of()).contains(result.rawStatus())) {
            return OrderStatus.PENDING;
        }
        return OrderStatus.FAILED;
    }
}
