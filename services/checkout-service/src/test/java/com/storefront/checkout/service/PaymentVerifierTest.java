package com.storefront.checkout.service;

import com.storefront.checkout.entity.OrderStatus;
import com.storefront.checkout.gateway.VerificationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentVerifierTest {

    private final PaymentVerifier verifier = new PaymentVerifier();

    @Test
    void unverified_result_never_moves_the_order() {
        assertThat(verifier.determineStatus("razorpay", VerificationResult.unverified("order_1", "SIGNATURE_MISMATCH")))
                .isEqualTo(OrderStatus.PENDING);
    }

    @Test
    void success_means_paid() {
        assertThat(verifier.determineStatus("phonepe",
                new VerificationResult(true, true, "TXN_1", "T1", "PAYMENT_SUCCESS")))
                .isEqualTo(OrderStatus.PAID);
    }

    @ParameterizedTest
    @CsvSource({
            "phonepe, PAYMENT_PENDING, PENDING",
            "phonepe, PAYMENT_INITIATED, PENDING",
            "phonepe, PAYMENT_ERROR, FAILED",
            "phonepe, PAYMENT_DECLINED, FAILED",
            "razorpay, created, PENDING",
            "razorpay, attempted, PENDING",
            "razorpay, authorized, PENDING",
            "razorpay, failed, FAILED",
            "razorpay, PAYMENT_PENDING, FAILED"
    })
    void provider_codes_map_to_order_status(String gateway, String rawStatus, OrderStatus expected) {
        assertThat(verifier.determineStatus(gateway, new VerificationResult(true, false, "ref", null, rawStatus)))
                .isEqualTo(expected);
    }

    @Test
    void unsuccessful_result_without_status_applies_no_transition() {
        assertThat(verifier.determineStatus("phonepe", new VerificationResult(true, false, "TXN_1", "T1", null)))
                .isEqualTo(OrderStatus.PENDING);
        assertThat(verifier.determineStatus("razorpay", new VerificationResult(true, false, "order_1", null, " ")))
                .isEqualTo(OrderStatus.PENDING);
    }
}
