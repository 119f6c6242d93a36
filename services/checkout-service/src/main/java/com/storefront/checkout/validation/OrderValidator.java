package com.storefront.checkout.validation;

import com.storefront.checkout.dto.AddressRequest;
import com.storefront.checkout.dto.CartItemRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Side-effect free checks on checkout input. Every method collects all problems
 * into a {@link ValidationReport} instead of stopping at the first one.
 */
@Component
public class OrderValidator {

    public static final int MAX_QUANTITY_PER_ITEM = 1000;
    public static final int MAX_NOTES_LENGTH = 500;

    // column widths of the shipping snapshot on the orders table
    private static final int MAX_NAME_LENGTH = 100;
    private static final int MAX_EMAIL_LENGTH = 255;
    private static final int MAX_LINE_LENGTH = 255;
    private static final int MAX_REGION_LENGTH = 100;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^(\\+91)?[6-9]\\d{9}$");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-()]");
    private static final Pattern PINCODE = Pattern.compile("^\\d{6}$");

    public ValidationReport validateCartItems(List<CartItemRequest> items) {
        if (items == null || items.isEmpty()) {
            return new ValidationReport(List.of("Cart is empty"));
        }
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            CartItemRequest item = items.get(i);
            String label = "Item " + (i + 1);
            if (item == null) {
                errors.add(label + ": missing");
                continue;
            }
            if (item.productId() == null) {
                errors.add(label + ": product is required");
            }
            Integer quantity = item.quantity();
            if (quantity == null || quantity < 1) {
                errors.add(label + ": quantity must be at least 1");
            } else if (quantity > MAX_QUANTITY_PER_ITEM) {
                errors.add(label + ": quantity must not exceed " + MAX_QUANTITY_PER_ITEM);
            }
        }
        return new ValidationReport(errors);
    }

    public ValidationReport validateShippingAddress(AddressRequest address) {
        if (address == null) {
            return new ValidationReport(List.of("Shipping address is required"));
        }
        List<String> errors = new ArrayList<>();
        requireText(errors, "name", address.name());
        requireText(errors, "email", address.email());
        requireText(errors, "phone", address.phone());
        requireText(errors, "address", address.line1());
        requireText(errors, "city", address.city());
        requireText(errors, "state", address.state());
        requireText(errors, "pincode", address.pincode());

        if (hasText(address.name())) {
            int length = address.name().trim().length();
            if (length < 2 || length > MAX_NAME_LENGTH) {
                errors.add("Name must be between 2 and " + MAX_NAME_LENGTH + " characters");
            }
        }
        if (hasText(address.email()) && !EMAIL.matcher(address.email().trim()).matches()) {
            errors.add("Invalid email format");
        }
        maxLength(errors, "Email", address.email(), MAX_EMAIL_LENGTH);
        maxLength(errors, "Address line 1", address.line1(), MAX_LINE_LENGTH);
        maxLength(errors, "Address line 2", address.line2(), MAX_LINE_LENGTH);
        maxLength(errors, "City", address.city(), MAX_REGION_LENGTH);
        maxLength(errors, "State", address.state(), MAX_REGION_LENGTH);
        if (hasText(address.phone())
                && !PHONE.matcher(PHONE_SEPARATORS.matcher(address.phone()).replaceAll("")).matches()) {
            errors.add("Invalid phone number format");
        }
        if (hasText(address.pincode()) && !PINCODE.matcher(address.pincode().trim()).matches()) {
            errors.add("Invalid pincode format");
        }
        return new ValidationReport(errors);
    }

    public ValidationReport validateNotes(String notes) {
        List<String> errors = new ArrayList<>();
        maxLength(errors, "Notes", notes, MAX_NOTES_LENGTH);
        return new ValidationReport(errors);
    }

    /**
     * Compares requested quantities with what {@code stockLookup} reports. Lines for
     * the same product are summed first, so splitting a quantity across lines
     * cannot get past the check.
     */
    public ValidationReport validateStockAvailability(List<CartItemRequest> items, StockLookup stockLookup) {
        Map<UUID, Integer> requested = new LinkedHashMap<>();
        for (CartItemRequest item : items) {
            requested.merge(item.productId(), item.quantity(), Integer::sum);
        }
        List<String> errors = new ArrayList<>();
        requested.forEach((productId, quantity) -> {
            Optional<Integer> available = stockLookup.availableStock(productId);
            if (available.isEmpty()) {
                errors.add("Product " + productId + ": Stock information not available");
            } else if (available.get() < quantity) {
                errors.add("Product " + productId + ": Insufficient stock. Available: "
                        + available.get() + ", Requested: " + quantity);
            }
        });
        return new ValidationReport(errors);
    }

    public ValidationReport validatePaymentPayload(Map<String, String> payload, Collection<String> requiredFields) {
        if (payload == null || payload.isEmpty()) {
            return new ValidationReport(List.of("Payment data is required"));
        }
        List<String> errors = new ArrayList<>();
        for (String field : requiredFields) {
            if (!hasText(payload.get(field))) {
                errors.add("Missing " + field);
            }
        }
        return new ValidationReport(errors);
    }

    private static void requireText(List<String> errors, String field, String value) {
        if (!hasText(value)) {
            errors.add(field + " is required");
        }
    }

    private static void maxLength(List<String> errors, String label, String value, int max) {
        if (value != null && value.length() > max) {
            errors.add(label + " must be at most " + max + " characters");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
