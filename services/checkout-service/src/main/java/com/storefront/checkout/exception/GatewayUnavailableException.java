package com.storefront.checkout.exception;

public class GatewayUnavailableException extends CheckoutException {

    public GatewayUnavailableException(String message) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message);
    }
}
