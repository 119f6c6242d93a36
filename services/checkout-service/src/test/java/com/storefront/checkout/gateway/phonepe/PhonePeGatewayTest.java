package com.storefront.checkout.gateway.phonepe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.checkout.TestOrders;
import com.storefront.checkout.entity.Order;
import com.storefront.checkout.entity.RefundStatus;
import com.storefront.checkout.exception.PaymentGatewayException;
import com.storefront.checkout.gateway.PaymentOrderContext;
import com.storefront.checkout.gateway.PaymentRequestResult;
import com.storefront.checkout.gateway.RefundRequest;
import com.storefront.checkout.gateway.RefundResult;
import com.storefront.checkout.gateway.VerificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PhonePeGatewayTest {

    private static final String BASE_URL = "https://pg.test";
    private static final String SALT_KEY = "099eb0cd-02cf-4e2a-8aca-3e6c6aff0399";
    private static final String MERCHANT_TXN = "TXN_1729300000000_a1b2c3d4e5f6";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockRestServiceServer server;
    private PhonePeGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new PhonePeGateway(properties(SALT_KEY), builder.build(), objectMapper);
    }

    private static PhonePeProperties properties(String saltKey) {
        return new PhonePeProperties("PGTESTPAYUAT", saltKey, "1", BASE_URL,
                "https://shop.test/payment/return", "https://api.shop.test/api/webhooks/phonepe");
    }

    // --- Checksum tests ---

    @Test
    void checksum_is_sha256_of_payload_and_salt_with_salt_index() {
        assertThat(gateway.checksum("/pg/v1/status/PGTESTPAYUAT/" + MERCHANT_TXN))
                .isEqualTo(sha256("/pg/v1/status/PGTESTPAYUAT/" + MERCHANT_TXN + SALT_KEY) + "###1");
    }

    // --- Pay request tests ---

    @Test
    void createPaymentRequest_posts_signed_base64_payload_and_returns_redirect_url() {
        Order order = TestOrders.pendingOrder(UUID.randomUUID(), PhonePeGateway.NAME, MERCHANT_TXN);
        server.expect(requestTo(BASE_URL + "/pg/v1/pay"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(request -> {
                    String body = ((MockClientHttpRequest) request).getBodyAsString();
                    String base64 = objectMapper.readTree(body).path("request").asText();
                    assertThat(request.getHeaders().getFirst("X-VERIFY"))
                            .isEqualTo(sha256(base64 + "/pg/v1/pay" + SALT_KEY) + "###1");

                    JsonNode payload = objectMapper.readTree(Base64.getDecoder().decode(base64));
                    assertThat(payload.path("merchantId").asText()).isEqualTo("PGTESTPAYUAT");
                    assertThat(payload.path("merchantTransactionId").asText()).isEqualTo(MERCHANT_TXN);
                    assertThat(payload.path("amount").asLong()).isEqualTo(13000L);
                    assertThat(payload.path("mobileNumber").asText()).isEqualTo("+919845012345");
                    assertThat(payload.path("redirectUrl").asText()).contains("orderId=" + order.getId());
                    assertThat(payload.at("/paymentInstrument/type").asText()).isEqualTo("PAY_PAGE");
                })
                .andRespond(withSuccess("""
                        {"success": true, "code": "PAYMENT_INITIATED",
                         "data": {"merchantTransactionId": "%s",
                                  "instrumentResponse": {"type": "PAY_PAGE",
                                      "redirectInfo": {"url": "https://mercury.phonepe.test/transact/abc", "method": "GET"}}}}
                        """.formatted(MERCHANT_TXN), MediaType.APPLICATION_JSON));

        PaymentRequestResult result = gateway.createPaymentRequest(PaymentOrderContext.from(order));

        assertThat(result.paymentUrl()).isEqualTo("https://mercury.phonepe.test/transact/abc");
        assertThat(result.transactionId()).isEqualTo(MERCHANT_TXN);
        assertThat(result.gatewayOrderId()).isNull();
        server.verify();
    }

    @Test
    void createPaymentRequest_rejected_by_provider_raises_gateway_error() {
        Order order = TestOrders.pendingOrder(UUID.randomUUID(), PhonePeGateway.NAME, MERCHANT_TXN);
        server.expect(requestTo(BASE_URL + "/pg/v1/pay"))
                .andRespond(withSuccess("{\"success\": false, \"code\": \"BAD_REQUEST\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.createPaymentRequest(PaymentOrderContext.from(order)))
                .isInstanceOf(PaymentGatewayException.class)
                .hasMessage("PhonePe rejected pay request: BAD_REQUEST");
    }

    @Test
    void createPaymentRequest_server_error_raises_gateway_error() {
        Order order = TestOrders.pendingOrder(UUID.randomUUID(), PhonePeGateway.NAME, MERCHANT_TXN);
        server.expect(requestTo(BASE_URL + "/pg/v1/pay"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> gateway.createPaymentRequest(PaymentOrderContext.from(order)))
                .isInstanceOf(PaymentGatewayException.class)
                .hasMessageStartingWith("PhonePe pay request failed");
    }

    @Test
    void createPaymentRequest_timeout_raises_gateway_error() {
        Order order = TestOrders.pendingOrder(UUID.randomUUID(), PhonePeGateway.NAME, MERCHANT_TXN);
        server.expect(requestTo(BASE_URL + "/pg/v1/pay"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> gateway.createPaymentRequest(PaymentOrderContext.from(order)))
                .isInstanceOf(PaymentGatewayException.class)
                .hasCauseInstanceOf(ResourceAccessException.class)
                .hasRootCauseInstanceOf(SocketTimeoutException.class);
    }

    @Test
    void createPaymentRequest_without_redirect_url_raises_gateway_error() {
        Order order = TestOrders.pendingOrder(UUID.randomUUID(), PhonePeGateway.NAME, MERCHANT_TXN);
        server.expect(requestTo(BASE_URL + "/pg/v1/pay"))
                .andRespond(withSuccess("{\"success\": true, \"code\": \"PAYMENT_INITIATED\", \"data\": {}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.createPaymentRequest(PaymentOrderContext.from(order)))
                .isInstanceOf(PaymentGatewayException.class)
                .hasMessageContaining("no redirect URL");
    }

    // --- Status tests ---

    @Test
    void checkStatus_success_is_verified_and_successful() {
        String path = "/pg/v1/status/PGTESTPAYUAT/" + MERCHANT_TXN;
        server.expect(requestTo(BASE_URL + path))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-VERIFY", sha256(path + SALT_KEY) + "###1"))
                .andExpect(header("X-MERCHANT-ID", "PGTESTPAYUAT"))
                .andRespond(withSuccess("""
                        {"success": true, "code": "PAYMENT_SUCCESS",
                         "data": {"merchantTransactionId": "%s", "transactionId": "T2410191200", "amount": 13000}}
                        """.formatted(MERCHANT_TXN), MediaType.APPLICATION_JSON));

        VerificationResult result = gateway.checkStatus(MERCHANT_TXN);

        assertThat(result.verified()).isTrue();
        assertThat(result.success()).isTrue();
        assertThat(result.correlationId()).isEqualTo(MERCHANT_TXN);
        assertThat(result.transactionId()).isEqualTo("T2410191200");
        assertThat(result.rawStatus()).isEqualTo("PAYMENT_SUCCESS");
        server.verify();
    }

    @Test
    void checkStatus_pending_is_not_successful() {
        server.expect(requestTo(BASE_URL + "/pg/v1/status/PGTESTPAYUAT/" + MERCHANT_TXN))
                .andRespond(withSuccess("""
                        {"success": true, "code": "PAYMENT_PENDING",
                         "data": {"merchantTransactionId": "%s"}}
                        """.formatted(MERCHANT_TXN), MediaType.APPLICATION_JSON));

        VerificationResult result = gateway.checkStatus(MERCHANT_TXN);

        assertThat(result.success()).isFalse();
        assertThat(result.rawStatus()).isEqualTo("PAYMENT_PENDING");
        assertThat(result.transactionId()).isNull();
    }

    @Test
    void verifyPaymentResponse_fetches_status_for_the_redirected_transaction() {
        server.expect(requestTo(BASE_URL + "/pg/v1/status/PGTESTPAYUAT/" + MERCHANT_TXN))
                .andRespond(withSuccess("""
                        {"success": false, "code": "PAYMENT_ERROR",
                         "data": {"merchantTransactionId": "%s", "transactionId": "T99"}}
                        """.formatted(MERCHANT_TXN), MediaType.APPLICATION_JSON));

        VerificationResult result = gateway.verifyPaymentResponse(
                Map.of("merchantTransactionId", MERCHANT_TXN, "code", "PAYMENT_SUCCESS"));

        assertThat(result.verified()).isTrue();
        assertThat(result.success()).isFalse();
        assertThat(result.rawStatus()).isEqualTo("PAYMENT_ERROR");
    }

    // --- Refund tests ---

    @Test
    void refund_posts_signed_payload_referencing_the_original_transaction() {
        UUID userId = UUID.fromString("9b2f4c3e-5d6a-4b7c-8d9e-0f1a2b3c4d5e");
        server.expect(requestTo(BASE_URL + "/pg/v1/refund"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(request -> {
                    String body = ((MockClientHttpRequest) request).getBodyAsString();
                    String base64 = objectMapper.readTree(body).path("request").asText();
                    assertThat(request.getHeaders().getFirst("X-VERIFY"))
                            .isEqualTo(sha256(base64 + "/pg/v1/refund" + SALT_KEY) + "###1");

                    JsonNode payload = objectMapper.readTree(Base64.getDecoder().decode(base64));
                    assertThat(payload.path("merchantId").asText()).isEqualTo("PGTESTPAYUAT");
                    assertThat(payload.path("merchantUserId").asText()).isEqualTo("MUID9b2f4c3e5d6a4b7c8d9e0f1a2b3c4d5e");
                    assertThat(payload.path("originalTransactionId").asText()).isEqualTo(MERCHANT_TXN);
                    assertThat(payload.path("merchantTransactionId").asText()).isEqualTo("RFD_1729400000000_0a1b2c3d4e5f");
                    assertThat(payload.path("amount").asLong()).isEqualTo(5000L);
                    assertThat(payload.path("callbackUrl").asText()).isEqualTo("https://api.shop.test/api/webhooks/phonepe");
                })
                .andRespond(withSuccess("""
                        {"success": true, "code": "PAYMENT_PENDING",
                         "data": {"merchantTransactionId": "RFD_1729400000000_0a1b2c3d4e5f",
                                  "transactionId": "TR2410201530", "amount": 5000, "state": "PENDING"}}
                        """, MediaType.APPLICATION_JSON));

        RefundResult result = gateway.refund(refundRequest(userId));

        assertThat(result.accepted()).isTrue();
        assertThat(result.status()).isEqualTo(RefundStatus.PENDING);
        assertThat(result.gatewayRefundId()).isEqualTo("TR2410201530");
        server.verify();
    }

    @Test
    void refund_completed_immediately_is_processed() {
        server.expect(requestTo(BASE_URL + "/pg/v1/refund"))
                .andRespond(withSuccess("""
                        {"success": true, "code": "PAYMENT_SUCCESS", "data": {"transactionId": "TR2410201531"}}
                        """, MediaType.APPLICATION_JSON));

        assertThat(gateway.refund(refundRequest(UUID.randomUUID())).status()).isEqualTo(RefundStatus.PROCESSED);
    }

    @Test
    void refund_refused_by_provider_is_rejected_not_thrown() {
        server.expect(requestTo(BASE_URL + "/pg/v1/refund"))
                .andRespond(withSuccess("{\"success\": false, \"code\": \"TRANSACTION_NOT_FOUND\"}",
                        MediaType.APPLICATION_JSON));

        RefundResult result = gateway.refund(refundRequest(UUID.randomUUID()));

        assertThat(result.accepted()).isFalse();
        assertThat(result.rawStatus()).isEqualTo("TRANSACTION_NOT_FOUND");
    }

    @Test
    void refund_timeout_raises_gateway_error() {
        server.expect(requestTo(BASE_URL + "/pg/v1/refund"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> gateway.refund(refundRequest(UUID.randomUUID())))
                .isInstanceOf(PaymentGatewayException.class)
                .hasMessageStartingWith("PhonePe refund request failed")
                .hasRootCauseInstanceOf(SocketTimeoutException.class);
    }

    // --- Webhook signature tests ---

    @Test
    void verifyWebhookSignature_accepts_signature_over_raw_body() {
        byte[] body = "{\"response\":\"eyJjb2RlIjoiUEFZTUVOVF9TVUNDRVNTIn0=\"}".getBytes(StandardCharsets.UTF_8);
        String signature = sha256(new String(body, StandardCharsets.UTF_8) + SALT_KEY) + "###1";

        assertThat(gateway.verifyWebhookSignature(body, signature)).isTrue();
    }

    @Test
    void verifyWebhookSignature_rejects_tampered_body() {
        byte[] body = "{\"response\":\"eyJjb2RlIjoiUEFZTUVOVF9FUlJPUiJ9\"}".getBytes(StandardCharsets.UTF_8);
        String signature = sha256(new String(body, StandardCharsets.UTF_8) + SALT_KEY) + "###1";
        byte[] tampered = "{\"response\":\"eyJjb2RlIjoiUEFZTUVOVF9TVUNDRVNTIn0=\"}".getBytes(StandardCharsets.UTF_8);

        assertThat(gateway.verifyWebhookSignature(tampered, signature)).isFalse();
    }

    @Test
    void verifyWebhookSignature_rejects_wrong_salt_index() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        String signature = sha256("{}" + SALT_KEY) + "###2";

        assertThat(gateway.verifyWebhookSignature(body, signature)).isFalse();
    }

    @Test
    void verifyWebhookSignature_fails_closed_when_unconfigured() {
        PhonePeGateway unconfigured = new PhonePeGateway(properties(null), RestClient.create(), objectMapper);
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThat(unconfigured.verifyWebhookSignature(body, sha256("{}null") + "###1")).isFalse();
    }

    private static RefundRequest refundRequest(UUID userId) {
        return new RefundRequest(UUID.randomUUID(), userId, "RFD_1729400000000_0a1b2c3d4e5f", MERCHANT_TXN,
                "T2410191200", 5000L, "INR", "Damaged in transit");
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
