package com.storefront.checkout.gateway;

/**
 * A provider's answer about one payment.
 *
 * @param verified      the answer is authentic (signature checked or fetched server-to-server)
 * @param success       the provider reports the money as captured
 * @param correlationId the merchant transaction id or provider order id the answer is about
 * @param transactionId the provider's payment/transaction id, if it has one yet
 * @param rawStatus     the provider's own status code, kept for status mapping and logs
 */
public record VerificationResult(
        boolean verified,
        boolean success,
        String correlationId,
        String transactionId,
        String rawStatus
) {
    public static VerificationResult unverified(String correlationId, String rawStatus) {
        return new VerificationResult(false, false, correlationId, null, rawStatus);
    }
}
