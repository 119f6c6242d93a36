package com.storefront.checkout.exception;

import java.util.List;

/**
 * A provider call failed, timed out, or answered with something unusable.
 */
public class PaymentGatewayException extends CheckoutException {

    private final String gateway;

    public PaymentGatewayException(String gateway, String message) {
        this(gateway, message, null);
    }

    public PaymentGatewayException(String gateway, String message, Throwable cause) {
        super(ErrorCode.GATEWAY_ERROR, message, List.of(), cause);
        this.gateway = gateway;
    }

    public String getGateway() { return gateway; }
}
