package com.storefront.checkout.gateway.phonepe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * PhonePe Standard Checkout. Redirect based: the customer is sent to a hosted pay
 * page and the outcome arrives later as a server-to-server callback. Every request
 * is authenticated with an {@code X-VERIFY} checksum of the form
 * {@code sha256(payload + saltKey) + "###" + saltIndex}.
 */
@Component
public class PhonePeGateway implements PaymentGateway {

    public static final String NAME = "phonepe";
    public static final String SIGNATURE_HEADER = "X-VERIFY";
    public static final String SUCCESS_CODE = "PAYMENT_SUCCESS";

    private static final Logger log = LoggerFactory.getLogger(PhonePeGateway.class);

    private static final String PAY_PATH = "/pg/v1/pay";
    private static final String STATUS_PATH = "/pg/v1/status/";
    private static final String REFUND_PATH = "/pg/v1/refund";

    private final PhonePeProperties properties;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public PhonePeGateway(PhonePeProperties properties, RestClient gatewayRestClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.restClient = gatewayRestClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PaymentRequestResult createPaymentRequest(PaymentOrderContext context) {
        String base64Payload = Base64.getEncoder().encodeToString(payRequestBody(context));
        JsonNode response;
        try {
            response = restClient.post()
                    .uri(properties.baseUrl() + PAY_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(SIGNATURE_HEADER, checksum(base64Payload + PAY_PATH))
                    .body(Map.of("request", base64Payload))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new PaymentGatewayException(NAME, "PhonePe pay request failed: " + e.getMessage(), e);
        }

        if (response == null || !response.path("success").asBoolean(false)) {
            String code = response == null ? "EMPTY_RESPONSE" : response.path("code").asText("UNKNOWN");
            throw new PaymentGatewayException(NAME, "PhonePe rejected pay request: " + code);
        }
        String paymentUrl = text(response.at("/data/instrumentResponse/redirectInfo/url"));
        if (paymentUrl == null) {
            throw new PaymentGatewayException(NAME, "PhonePe response carried no redirect URL");
        }
        log.info("PhonePe pay page created for order {}: merchantTransactionId={}",
                context.orderId(), context.merchantTransactionId());
        return new PaymentRequestResult(paymentUrl, context.merchantTransactionId(), null);
    }

    /**
     * Redirect parameters are not signed in a way that proves the outcome, so the
     * status is always fetched from PhonePe directly.
     */
    @Override
    public VerificationResult verifyPaymentResponse(Map<String, String> payload) {
        return checkStatus(payload.get("merchantTransactionId"));
    }

    @Override
    public VerificationResult checkStatus(String merchantTransactionId) {
        String path = STATUS_PATH + properties.merchantId() + "/" + merchantTransactionId;
        JsonNode response;
        try {
            response = restClient.get()
                    .uri(properties.baseUrl() + path)
                    .header(SIGNATURE_HEADER, checksum(path))
                    .header("X-MERCHANT-ID", properties.merchantId())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new PaymentGatewayException(NAME, "PhonePe status check failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new PaymentGatewayException(NAME, "PhonePe status check returned no body");
        }

        String code = text(response.path("code"));
        boolean success = response.path("success").asBoolean(false) && SUCCESS_CODE.equals(code);
        String correlationId = text(response.at("/data/merchantTransactionId"));
        return new VerificationResult(
                true,
                success,
                correlationId != null ? correlationId : merchantTransactionId,
                text(response.at("/data/transactionId")),
                code);
    }

    /**
     * The refund runs as its own PhonePe transaction: the merchant refund id is
     * sent as {@code merchantTransactionId} and the paid one as
     * {@code originalTransactionId}.
     */
    @Override
    public RefundResult refund(RefundRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("merchantId", properties.merchantId());
        body.put("merchantUserId", merchantUserId(request.userId()));
        body.put("originalTransactionId", request.merchantTransactionId());
        body.put("merchantTransactionId", request.refundId());
        body.put("amount", request.amount());
        body.put("callbackUrl", properties.callbackUrl());
        String base64Payload = Base64.getEncoder().encodeToString(toJson(body, "refund request"));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(properties.baseUrl() + REFUND_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(SIGNATURE_HEADER, checksum(base64Payload + REFUND_PATH))
                    .body(Map.of("request", base64Payload))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException e) {
            log.warn("PhonePe refused refund {} for order {}: HTTP {}",
                    request.refundId(), request.orderId(), e.getStatusCode().value());
            return RefundResult.rejected("HTTP_" + e.getStatusCode().value());
        } catch (RestClientException e) {
            throw new PaymentGatewayException(NAME, "PhonePe refund request failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new PaymentGatewayException(NAME, "PhonePe refund request returned no body");
        }

        String code = text(response.path("code"));
        if (!response.path("success").asBoolean(false)) {
            log.warn("PhonePe refused refund {} for order {}: {}", request.refundId(), request.orderId(), code);
            return RefundResult.rejected(code != null ? code : "UNKNOWN");
        }
        RefundStatus status = SUCCESS_CODE.equals(code) ? RefundStatus.PROCESSED : RefundStatus.PENDING;
        log.info("PhonePe refund {} accepted for order {}: code={}", request.refundId(), request.orderId(), code);
        return new RefundResult(status, text(response.at("/data/transactionId")), code);
    }

    @Override
    public boolean verifyWebhookSignature(byte[] rawBody, String signatureHeader) {
        if (!isConfigured() || rawBody == null || signatureHeader == null) {
            return false;
        }
        String expected = GatewaySignatures.sha256Hex(rawBody, properties.saltKey().getBytes(StandardCharsets.UTF_8))
                + "###" + properties.saltIndex();
        return GatewaySignatures.matches(expected, signatureHeader.trim());
    }

    @Override
    public List<String> requiredPaymentFields() {
        return List.of("merchantTransactionId");
    }

    @Override
    public boolean isConfigured() {
        return properties.isComplete();
    }

    @Override
    public Map<String, Object> clientConfig() {
        return Map.of("gateway", NAME, "flow", "redirect");
    }

    String checksum(String payload) {
        return GatewaySignatures.sha256Hex(payload + properties.saltKey()) + "###" + properties.saltIndex();
    }

    private byte[] payRequestBody(PaymentOrderContext context) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("merchantId", properties.merchantId());
        request.put("merchantTransactionId", context.merchantTransactionId());
        request.put("merchantUserId", merchantUserId(context.userId()));
        request.put("amount", context.amount());
        request.put("redirectUrl", UriComponentsBuilder.fromUriString(properties.redirectUrl())
                .queryParam("orderId", context.orderId())
                .toUriString());
        request.put("redirectMode", "POST");
        request.put("callbackUrl", properties.callbackUrl());
        request.put("mobileNumber", context.customerPhone());
        request.put("paymentInstrument", Map.of("type", "PAY_PAGE"));
        return toJson(request, "pay request");
    }

    private byte[] toJson(Map<String, Object> request, String kind) {
        try {
            return objectMapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize PhonePe " + kind, e);
        }
    }

    private static String merchantUserId(UUID userId) {
        return "MUID" + userId.toString().replace("-", "");
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
