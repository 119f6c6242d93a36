package com.storefront.checkout.gateway.phonepe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.storefront.checkout.exception.ValidationException;
import com.storefront.checkout.gateway.VerificationResult;
import com.storefront.checkout.webhook.FieldPrecedence;
import com.storefront.checkout.webhook.WebhookAdapter;
import com.storefront.checkout.webhook.WebhookNotification;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;
import java.util.List;

/**
 * PhonePe callbacks arrive as {@code {"response": "<base64 json>"}}; older
 * integrations and the simulator post the JSON directly. The decoded document is
 * searched before the outer body.
 */
@Component
public class PhonePeWebhookAdapter implements WebhookAdapter {

    static final FieldPrecedence MERCHANT_TRANSACTION_ID = FieldPrecedence.of("merchant transaction id",
            "/merchantTransactionId",
            "/merchant_transaction_id",
            "/data/merchantTransactionId",
            "/response/merchantTransactionId");

    static final FieldPrecedence TRANSACTION_ID = FieldPrecedence.of("transaction id",
            "/data/transactionId",
            "/transactionId");

    static final FieldPrecedence CODE = FieldPrecedence.of("status code",
            "/code",
            "/data/code");

    private final ObjectMapper objectMapper;

    public PhonePeWebhookAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String gateway() {
        return PhonePeGateway.NAME;
    }

    @Override
    public WebhookNotification normalize(byte[] rawBody) {
        JsonNode outer = parse(rawBody);
        JsonNode decoded = decodeResponse(outer);

        String merchantTransactionId = MERCHANT_TRANSACTION_ID.resolve(decoded, outer)
                .orElseThrow(() -> new ValidationException(List.of("Webhook carries no " + MERCHANT_TRANSACTION_ID.field())));
        String transactionId = TRANSACTION_ID.resolve(decoded, outer).orElse(null);
        String code = CODE.resolve(decoded, outer).orElse(null);

        VerificationResult result = new VerificationResult(
                true, PhonePeGateway.SUCCESS_CODE.equals(code), merchantTransactionId, transactionId, code);
        return WebhookNotification.of(code, merchantTransactionId, result);
    }

    private JsonNode decodeResponse(JsonNode outer) {
        JsonNode response = outer.path("response");
        if (!response.isTextual()) {
            return MissingNode.getInstance();
        }
        try {
            return parse(Base64.getDecoder().decode(response.asText()));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(List.of("Webhook response is not valid base64"));
        }
    }

    private JsonNode parse(byte[] body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new ValidationException(List.of("Webhook body must be a JSON object"));
            }
            return node;
        } catch (IOException e) {
            throw new ValidationException(List.of("Webhook body is not valid JSON"));
        }
    }
}
