package com.storefront.checkout.gateway.razorpay;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.checkout.entity.RefundStatus;
import com.storefront.checkout.exception.PaymentGatewayException;
import com.storefront.checkout.gateway.GatewaySignatures;
import com.storefront.checkout.gateway.PaymentGateway;
import com.storefront.checkout.gateway.PaymentOrderContext;
import com.storefront.checkout.gateway.PaymentRequestResult;
import com.storefront.checkout.gateway.RefundRequest;
import com.storefront.checkout.gateway.RefundResult;
import com.storefront.checkout.gateway.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Razorpay Orders API. A Razorpay order is created up front and the browser
 * opens Razorpay Checkout against it; the redirect back is authenticated by an
 * HMAC over {@code order_id|payment_id} keyed with the API secret, webhooks by an
 * HMAC over the raw body keyed with the webhook secret.
 */
@Component
public class RazorpayGateway implements PaymentGateway {

    public static final String NAME = "razorpay";
    public static final String SIGNATURE_HEADER = "X-Razorpay-Signature";

    private static final Logger log = LoggerFactory.getLogger(RazorpayGateway.class);

    private final RazorpayProperties properties;
    private final RestClient restClient;

    public RazorpayGateway(RazorpayProperties properties, RestClient gatewayRestClient) {
        this.properties = properties;
        this.restClient = gatewayRestClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PaymentRequestResult createPaymentRequest(PaymentOrderContext context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", context.amount());
        body.put("currency", context.currency());
        body.put("receipt", context.receipt());
        body.put("payment_capture", 1);
        body.put("notes", Map.of(
                "order_id", context.orderId().toString(),
                "merchant_transaction_id", context.merchantTransactionId(),
                "user_id", context.userId().toString()));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(properties.baseUrl() + "/v1/orders")
                    .headers(headers -> headers.setBasicAuth(properties.keyId(), properties.keySecret()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new PaymentGatewayException(NAME, "Razorpay order creation failed: " + e.getMessage(), e);
        }

        String razorpayOrderId = response == null ? null : text(response.path("id"));
        if (razorpayOrderId == null) {
            throw new PaymentGatewayException(NAME, "Razorpay order response carried no order id");
        }
        log.info("Razorpay order {} created for order {}", razorpayOrderId, context.orderId());
        return new PaymentRequestResult(null, context.merchantTransactionId(), razorpayOrderId);
    }

    @Override
    public VerificationResult verifyPaymentResponse(Map<String, String> payload) {
        String orderId = payload.get("razorpay_order_id");
        String paymentId = payload.get("razorpay_payment_id");
        String signature = payload.get("razorpay_signature");

        if (!isPaymentSignatureValid(orderId, paymentId, signature)) {
            log.warn("SECURITY: Razorpay payment signature mismatch for razorpay order {}", orderId);
            return VerificationResult.unverified(orderId, "SIGNATURE_MISMATCH");
        }

        JsonNode payment = get("/v1/payments/" + paymentId, "payment fetch");
        if (!orderId.equals(text(payment.path("order_id")))) {
            log.warn("SECURITY: Razorpay payment {} does not belong to razorpay order {}", paymentId, orderId);
            return VerificationResult.unverified(orderId, "ORDER_MISMATCH");
        }
        String status = text(payment.path("status"));
        return new VerificationResult(true, "captured".equals(status), orderId, paymentId, status);
    }

    @Override
    public VerificationResult checkStatus(String razorpayOrderId) {
        JsonNode order = get("/v1/orders/" + razorpayOrderId, "order fetch");
        String status = text(order.path("status"));
        if (!"paid".equals(status)) {
            return new VerificationResult(true, false, razorpayOrderId, null, status);
        }
        return new VerificationResult(true, true, razorpayOrderId, capturedPaymentId(razorpayOrderId), status);
    }

    /**
     * Refunds are issued against the captured payment, so an order settled without
     * a payment id cannot be refunded from here.
     */
    @Override
    public RefundResult refund(RefundRequest request) {
        if (request.gatewayPaymentId() == null) {
            log.warn("Razorpay refund {} for order {} has no payment id to refund", request.refundId(), request.orderId());
            return RefundResult.rejected("NO_PAYMENT_ID");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", request.amount());
        body.put("receipt", request.refundId());
        Map<String, String> notes = new LinkedHashMap<>();
        notes.put("order_id", request.orderId().toString());
        if (request.reason() != null) {
            notes.put("reason", request.reason());
        }
        body.put("notes", notes);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(properties.baseUrl() + "/v1/payments/" + request.gatewayPaymentId() + "/refund")
                    .headers(headers -> headers.setBasicAuth(properties.keyId(), properties.keySecret()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException e) {
            String code = errorCode(e);
            log.warn("Razorpay refused refund {} for payment {}: {}", request.refundId(), request.gatewayPaymentId(), code);
            return RefundResult.rejected(code);
        } catch (RestClientException e) {
            throw new PaymentGatewayException(NAME, "Razorpay refund failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new PaymentGatewayException(NAME, "Razorpay refund returned no body");
        }

        String status = text(response.path("status"));
        RefundStatus refundStatus = switch (status == null ? "" : status) {
            case "processed" -> RefundStatus.PROCESSED;
            case "failed" -> RefundStatus.REJECTED;
            default -> RefundStatus.PENDING;
        };
        if (refundStatus == RefundStatus.REJECTED) {
            return RefundResult.rejected(status);
        }
        String refundId = text(response.path("id"));
        log.info("Razorpay refund {} created for payment {}: status={}", refundId, request.gatewayPaymentId(), status);
        return new RefundResult(refundStatus, refundId, status);
    }

    @Override
    public boolean verifyWebhookSignature(byte[] rawBody, String signatureHeader) {
        String webhookSecret = properties.webhookSecret();
        if (webhookSecret == null || webhookSecret.isBlank() || rawBody == null || signatureHeader == null) {
            return false;
        }
        String expected = GatewaySignatures.hmacSha256Hex(webhookSecret, rawBody);
        return GatewaySignatures.matches(expected, signatureHeader.trim());
    }

    @Override
    public List<String> requiredPaymentFields() {
        return List.of("razorpay_order_id", "razorpay_payment_id", "razorpay_signature");
    }

    @Override
    public boolean isConfigured() {
        return properties.isComplete();
    }

    @Override
    public Map<String, Object> clientConfig() {
        return Map.of(
                "gateway", NAME,
                "flow", "checkout",
                "keyId", properties.keyId(),
                "name", properties.merchantName(),
                "theme", Map.of("color", properties.themeColor()));
    }

    boolean isPaymentSignatureValid(String orderId, String paymentId, String signature) {
        if (orderId == null || paymentId == null || signature == null) {
            return false;
        }
        String expected = GatewaySignatures.hmacSha256Hex(properties.keySecret(), orderId + "|" + paymentId);
        return GatewaySignatures.matches(expected, signature);
    }

    private String capturedPaymentId(String razorpayOrderId) {
        JsonNode payments = get("/v1/orders/" + razorpayOrderId + "/payments", "order payments fetch");
        for (JsonNode payment : payments.path("items")) {
            if ("captured".equals(text(payment.path("status")))) {
                return text(payment.path("id"));
            }
        }
        return null;
    }

    private JsonNode get(String path, String operation) {
        JsonNode response;
        try {
            response = restClient.get()
                    .uri(properties.baseUrl() + path)
                    .headers(headers -> headers.setBasicAuth(properties.keyId(), properties.keySecret()))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new PaymentGatewayException(NAME, "Razorpay " + operation + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new PaymentGatewayException(NAME, "Razorpay " + operation + " returned no body");
        }
        return response;
    }

    private static String errorCode(HttpClientErrorException e) {
        try {
            JsonNode error = e.getResponseBodyAs(JsonNode.class);
            String code = error == null ? null : text(error.at("/error/code"));
            if (code != null) {
                return code;
            }
        } catch (RuntimeException parseFailure) {
            log.debug("Razorpay error body was not JSON: {}", parseFailure.getMessage());
        }
        return "HTTP_" + e.getStatusCode().value();
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
