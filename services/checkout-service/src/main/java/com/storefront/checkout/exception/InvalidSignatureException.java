package com.storefront.checkout.exception;

/**
 * Webhook authentication failed. The message is deliberately constant so a
 * caller cannot learn which check rejected the request.
 */
public class InvalidSignatureException extends CheckoutException {

    public InvalidSignatureException() {
        super(ErrorCode.INVALID_SIGNATURE, ErrorCode.INVALID_SIGNATURE.defaultMessage());
    }
}
