package com.storefront.checkout.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Merchant-side ids, created before any provider call. Both stay within the
 * 38 character limit PhonePe puts on transaction ids and the 40 Razorpay puts
 * on receipts.
 */
@Component
public class TransactionIdGenerator {

    private final Clock clock;

    public TransactionIdGenerator() {
        this(Clock.systemUTC());
    }

    TransactionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String merchantTransactionId() {
        return "TXN_" + clock.millis() + "_" + randomHex(12);
    }

    public String refundId() {
        return "RFD_" + clock.millis() + "_" + randomHex(12);
    }

    public String receipt() {
        return "rcpt_" + clock.millis() + "_" + randomHex(8);
    }

    private static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
