package com.storefront.checkout.gateway.razorpay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.checkout.exception.ValidationException;
import com.storefront.checkout.webhook.WebhookNotification;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RazorpayWebhookAdapterTest {

    private final RazorpayWebhookAdapter adapter = new RazorpayWebhookAdapter(new ObjectMapper());

    @Test
    void payment_captured_is_a_successful_notification() {
        WebhookNotification notification = adapter.normalize(bytes("""
                {"entity": "event", "event": "payment.captured",
                 "payload": {"payment": {"entity": {"id": "pay_29QQ", "order_id": "order_Nx81", "status": "captured"}}}}
                """));

        assertThat(notification.actionable()).isTrue();
        assertThat(notification.correlationId()).isEqualTo("order_Nx81");
        assertThat(notification.result().success()).isTrue();
        assertThat(notification.result().transactionId()).isEqualTo("pay_29QQ");
        assertThat(notification.result().rawStatus()).isEqualTo("captured");
    }

    @Test
    void order_paid_takes_order_id_from_order_entity() {
        WebhookNotification notification = adapter.normalize(bytes("""
                {"event": "order.paid",
                 "payload": {"payment": {"entity": {"id": "pay_29QQ", "order_id": "order_FromPayment", "status": "captured"}},
                             "order": {"entity": {"id": "order_Nx81", "status": "paid"}}}}
                """));

        assertThat(notification.correlationId()).isEqualTo("order_Nx81");
        assertThat(notification.result().success()).isTrue();
    }

    @Test
    void payment_failed_is_an_unsuccessful_notification() {
        WebhookNotification notification = adapter.normalize(bytes("""
                {"event": "payment.failed",
                 "payload": {"payment": {"entity": {"id": "pay_F1", "order_id": "order_Nx81", "status": "failed"}}}}
                """));

        assertThat(notification.actionable()).isTrue();
        assertThat(notification.result().success()).isFalse();
        assertThat(notification.result().rawStatus()).isEqualTo("failed");
    }

    @Test
    void other_events_are_ignored() {
        WebhookNotification notification = adapter.normalize(bytes("""
                {"event": "refund.processed", "payload": {"refund": {"entity": {"id": "rfnd_1"}}}}
                """));

        assertThat(notification.actionable()).isFalse();
        assertThat(notification.event()).isEqualTo("refund.processed");
        assertThat(notification.result()).isNull();
    }

    @Test
    void capture_without_order_id_falls_back_to_merchant_transaction_id_note() {
        WebhookNotification notification = adapter.normalize(bytes("""
                {"event": "payment.captured",
                 "payload": {"payment": {"entity": {"id": "pay_29QQ", "status": "captured",
                   "notes": {"order_id": "6f1c", "merchant_transaction_id": "TXN_1729300000000_a1b2c3d4e5f6"}}}}}
                """));

        assertThat(notification.correlationId()).isEqualTo("TXN_1729300000000_a1b2c3d4e5f6");
        assertThat(notification.result().correlationId()).isEqualTo("TXN_1729300000000_a1b2c3d4e5f6");
        assertThat(notification.result().success()).isTrue();
    }

    @Test
    void gateway_order_id_wins_over_merchant_transaction_id_note() {
        WebhookNotification notification = adapter.normalize(bytes("""
                {"event": "payment.captured",
                 "payload": {"payment": {"entity": {"id": "pay_29QQ", "order_id": "order_Nx81", "status": "captured",
                   "notes": {"merchant_transaction_id": "TXN_1729300000000_a1b2c3d4e5f6"}}}}}
                """));

        assertThat(notification.correlationId()).isEqualTo("order_Nx81");
    }

    @Test
    void actionable_event_without_order_id_is_rejected() {
        assertThatThrownBy(() -> adapter.normalize(bytes("{\"event\": \"payment.captured\", \"payload\": {}}")))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getDetails()).containsExactly("Webhook carries no order id"));
    }

    @Test
    void invalid_json_is_rejected() {
        assertThatThrownBy(() -> adapter.normalize(bytes("{\"event\":")))
                .isInstanceOf(ValidationException.class);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
