package com.storefront.checkout.validation;

import java.util.ArrayList;
import java.util.List;

public record ValidationReport(List<String> errors) {

    private static final ValidationReport VALID = new ValidationReport(List.of());

    public ValidationReport {
        errors = List.copyOf(errors);
    }

    public static ValidationReport valid() {
        return VALID;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public ValidationReport and(ValidationReport other) {
        if (other.isValid()) {
            return this;
        }
        List<String> combined = new ArrayList<>(errors);
        combined.addAll(other.errors);
        return new ValidationReport(combined);
    }
}
