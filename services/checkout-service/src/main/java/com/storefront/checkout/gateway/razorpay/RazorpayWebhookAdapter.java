package com.storefront.checkout.gateway.razorpay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.checkout.exception.ValidationException;
import com.storefront.checkout.gateway.VerificationResult;
import com.storefront.checkout.webhook.FieldPrecedence;
import com.storefront.checkout.webhook.WebhookAdapter;
import com.storefront.checkout.webhook.WebhookNotification;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Set;

@Component
public class RazorpayWebhookAdapter implements WebhookAdapter {

    static final Set<String> SUCCESS_EVENTS = Set.of("payment.captured", "order.paid");
    static final Set<String> FAILURE_EVENTS = Set.of("payment.failed");

    static final FieldPrecedence EVENT = FieldPrecedence.of("event",
            "/event");

    // the notes fallback covers a capture that beats the gateway order id onto the order row
    static final FieldPrecedence ORDER_ID = FieldPrecedence.of("order id",
            "/payload/order/entity/id",
            "/payload/payment/entity/order_id",
            "/order_id",
            "/payload/payment/entity/notes/merchant_transaction_id");

    static final FieldPrecedence PAYMENT_ID = FieldPrecedence.of("payment id",
            "/payload/payment/entity/id",
            "/payment_id");

    static final FieldPrecedence PAYMENT_STATUS = FieldPrecedence.of("payment status",
            "/payload/payment/entity/status",
            "/payload/order/entity/status");

    private final ObjectMapper objectMapper;

    public RazorpayWebhookAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String gateway() {
        return RazorpayGateway.NAME;
    }

    @Override
    public WebhookNotification normalize(byte[] rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            throw new ValidationException(List.of("Webhook body is not valid JSON"));
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(List.of("Webhook body must be a JSON object"));
        }

        String event = EVENT.resolve(root).orElse("");
        boolean success = SUCCESS_EVENTS.contains(event);
        if (!success && !FAILURE_EVENTS.contains(event)) {
            return WebhookNotification.ignored(event);
        }

        String orderId = ORDER_ID.resolve(root)
                .orElseThrow(() -> new ValidationException(List.of("Webhook carries no " + ORDER_ID.field())));
        String paymentId = PAYMENT_ID.resolve(root).orElse(null);
        String status = PAYMENT_STATUS.resolve(root).orElse(event);

        return WebhookNotification.of(event, orderId, new VerificationResult(true, success, orderId, paymentId, status));
    }
}
