package com.storefront.checkout.exception;

import java.util.List;

/**
 * Base of every error the checkout core raises on purpose. The {@link ErrorCode}
 * decides how the HTTP layer renders it; {@link #getDetails()} carries the
 * individual messages when one failure aggregates several problems.
 */
public abstract class CheckoutException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<String> details;

    protected CheckoutException(ErrorCode errorCode, String message) {
        this(errorCode, message, List.of(), null);
    }

    protected CheckoutException(ErrorCode errorCode, String message, List<String> details) {
        this(errorCode, message, details, null);
    }

    protected CheckoutException(ErrorCode errorCode, String message, List<String> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = List.copyOf(details);
    }

    public ErrorCode getErrorCode() { return errorCode; }
    public List<String> getDetails() { return details; }
}
