package com.storefront.checkout.controller;

import com.storefront.checkout.dto.WebhookResult;
import com.storefront.checkout.gateway.phonepe.PhonePeGateway;
import com.storefront.checkout.gateway.razorpay.RazorpayGateway;
import com.storefront.checkout.service.CheckoutOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Provider callbacks. The body is taken as raw bytes so the signature is checked
 * against exactly what the provider sent.
 */
@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

    private static final List<String> SIGNATURE_HEADERS = List.of(
            RazorpayGateway.SIGNATURE_HEADER,
            PhonePeGateway.SIGNATURE_HEADER
    );

    private final CheckoutOrchestrator checkoutOrchestrator;

    public WebhookController(CheckoutOrchestrator checkoutOrchestrator) {
        this.checkoutOrchestrator = checkoutOrchestrator;
    }

    @PostMapping("/{gateway}")
    public ResponseEntity<WebhookResult> handleWebhook(
            @PathVariable String gateway,
            @RequestHeader HttpHeaders headers,
            @RequestBody byte[] rawBody) {
        return ResponseEntity.ok(checkoutOrchestrator.handleWebhook(gateway, rawBody, signature(headers)));
    }

    private static String signature(HttpHeaders headers) {
        for (String name : SIGNATURE_HEADERS) {
            String value = headers.getFirst(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
