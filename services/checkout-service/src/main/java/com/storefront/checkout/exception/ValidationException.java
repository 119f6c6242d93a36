package com.storefront.checkout.exception;

import java.util.List;

public class ValidationException extends CheckoutException {

    public ValidationException(List<String> errors) {
        super(ErrorCode.VALIDATION_FAILED, "Validation failed: " + String.join("; ", errors), errors);
    }
}
