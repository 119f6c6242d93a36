package com.storefront.checkout.controller;

import com.storefront.checkout.dto.CancelOrderRequest;
import com.storefront.checkout.dto.CheckoutRequest;
import com.storefront.checkout.dto.CheckoutResult;
import com.storefront.checkout.dto.OrderResponse;
import com.storefront.checkout.dto.PaymentVerificationResult;
import com.storefront.checkout.dto.RefundOrderRequest;
import com.storefront.checkout.service.CheckoutOrchestrator;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/checkout")
public class CheckoutController {

    private final CheckoutOrchestrator checkoutOrchestrator;

    public CheckoutController(CheckoutOrchestrator checkoutOrchestrator) {
        this.checkoutOrchestrator = checkoutOrchestrator;
    }

    @PostMapping("/orders")
    public ResponseEntity<CheckoutResult> initiateCheckout(
            @RequestHeader("X-User-Id") UUID userId,
            @Valid @RequestBody CheckoutRequest request) {
        CheckoutResult result = checkoutOrchestrator.initiateCheckout(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/orders/{orderId}/verify")
    public ResponseEntity<PaymentVerificationResult> verifyPayment(
            @PathVariable UUID orderId,
            @RequestBody Map<String, String> payload) {
        return ResponseEntity.ok(checkoutOrchestrator.verifyPayment(orderId, payload));
    }

    @GetMapping("/payments/{correlationId}")
    public ResponseEntity<PaymentVerificationResult> checkPaymentStatus(@PathVariable String correlationId) {
        return ResponseEntity.ok(checkoutOrchestrator.checkPaymentStatus(correlationId));
    }

    @PostMapping("/orders/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable UUID orderId,
            @Valid @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request == null ? null : request.reason();
        return ResponseEntity.ok(checkoutOrchestrator.cancelOrder(orderId, reason));
    }

    @PostMapping("/orders/{orderId}/ship")
    public ResponseEntity<OrderResponse> markShipped(@PathVariable UUID orderId) {
        return ResponseEntity.ok(checkoutOrchestrator.markShipped(orderId));
    }

    @PostMapping("/orders/{orderId}/refund")
    public ResponseEntity<OrderResponse> refundOrder(
            @PathVariable UUID orderId,
            @Valid @RequestBody(required = false) RefundOrderRequest request) {
        Long amount = request == null ? null : request.amount();
        String reason = request == null ? null : request.reason();
        return ResponseEntity.ok(checkoutOrchestrator.refundOrder(orderId, amount, reason));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable UUID orderId) {
        return ResponseEntity.ok(checkoutOrchestrator.getOrder(orderId));
    }

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> gatewayConfig() {
        return ResponseEntity.ok(checkoutOrchestrator.gatewayClientConfig());
    }
}
