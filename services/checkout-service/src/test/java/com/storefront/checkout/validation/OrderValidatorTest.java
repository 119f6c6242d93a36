package com.storefront.checkout.validation;

import com.storefront.checkout.TestOrders;
import com.storefront.checkout.dto.AddressRequest;
import com.storefront.checkout.dto.CartItemRequest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.storefront.checkout.TestOrders.DIYA_ID;
import static com.storefront.checkout.TestOrders.KURTA_ID;
import static org.assertj.core.api.Assertions.assertThat;

class OrderValidatorTest {

    private final OrderValidator validator = new OrderValidator();

    // --- Cart ---

    @Test
    void empty_cart_is_rejected() {
        assertThat(validator.validateCartItems(List.of()).errors()).containsExactly("Cart is empty");
        assertThat(validator.validateCartItems(null).errors()).containsExactly("Cart is empty");
    }

    @Test
    void quantity_bounds_are_enforced_per_line() {
        ValidationReport report = validator.validateCartItems(List.of(
                new CartItemRequest(KURTA_ID, 1),
                new CartItemRequest(DIYA_ID, 1000),
                new CartItemRequest(KURTA_ID, 1001),
                new CartItemRequest(DIYA_ID, null)));

        assertThat(report.errors()).containsExactly(
                "Item 3: quantity must not exceed 1000",
                "Item 4: quantity must be at least 1");
    }

    @Test
    void all_cart_problems_are_reported_together() {
        ValidationReport report = validator.validateCartItems(List.of(
                new CartItemRequest(null, -2),
                new CartItemRequest(KURTA_ID, 2)));

        assertThat(report.isValid()).isFalse();
        assertThat(report.errors()).containsExactly(
                "Item 1: product is required",
                "Item 1: quantity must be at least 1");
    }

    // --- Address ---

    @Test
    void well_formed_address_is_valid() {
        assertThat(validator.validateShippingAddress(TestOrders.address()).isValid()).isTrue();
    }

    @Test
    void missing_address_is_rejected() {
        assertThat(validator.validateShippingAddress(null).errors()).containsExactly("Shipping address is required");
    }

    @Test
    void missing_fields_are_each_named() {
        ValidationReport report = validator.validateShippingAddress(
                new AddressRequest(" ", null, "", null, null, "", null, null));

        assertThat(report.errors()).containsExactly(
                "name is required", "email is required", "phone is required", "address is required",
                "city is required", "state is required", "pincode is required");
    }

    @Test
    void phone_accepts_indian_mobile_numbers_with_separators() {
        assertThat(phoneErrors("9845012345")).isEmpty();
        assertThat(phoneErrors("+91 98450-12345")).isEmpty();
        assertThat(phoneErrors("(+91) 98450 12345")).isEmpty();
        assertThat(phoneErrors("5845012345")).containsExactly("Invalid phone number format");
        assertThat(phoneErrors("98450123")).containsExactly("Invalid phone number format");
    }

    @Test
    void email_pincode_and_name_formats_are_checked() {
        ValidationReport report = validator.validateShippingAddress(new AddressRequest(
                "A", "asha@example", "9845012345", "12 MG Road", null, "Bengaluru", "Karnataka", "56000A"));

        assertThat(report.errors()).containsExactly(
                "Name must be between 2 and 100 characters",
                "Invalid email format",
                "Invalid pincode format");
    }

    @Test
    void address_fields_longer_than_their_columns_are_rejected() {
        ValidationReport report = validator.validateShippingAddress(new AddressRequest(
                "Asha Rao", "a".repeat(251) + "@x.in", "9845012345", "L".repeat(256), "l".repeat(300),
                "C".repeat(150), "S".repeat(300), "560001"));

        assertThat(report.errors()).containsExactly(
                "Email must be at most 255 characters",
                "Address line 1 must be at most 255 characters",
                "Address line 2 must be at most 255 characters",
                "City must be at most 100 characters",
                "State must be at most 100 characters");
    }

    @Test
    void address_fields_at_their_column_width_are_accepted() {
        ValidationReport report = validator.validateShippingAddress(new AddressRequest(
                "N".repeat(100), "a".repeat(250) + "@x.in", "9845012345", "L".repeat(255), "l".repeat(255),
                "C".repeat(100), "S".repeat(100), "560001"));

        assertThat(report.isValid()).isTrue();
    }

    @Test
    void notes_are_bounded() {
        assertThat(validator.validateNotes(null).isValid()).isTrue();
        assertThat(validator.validateNotes("n".repeat(500)).isValid()).isTrue();
        assertThat(validator.validateNotes("n".repeat(501)).errors())
                .containsExactly("Notes must be at most 500 characters");
    }

    // --- Stock ---

    @Test
    void stock_check_sums_lines_for_the_same_product() {
        ValidationReport report = validator.validateStockAvailability(
                List.of(new CartItemRequest(KURTA_ID, 3), new CartItemRequest(KURTA_ID, 3)),
                productId -> Optional.of(5));

        assertThat(report.errors()).containsExactly(
                "Product " + KURTA_ID + ": Insufficient stock. Available: 5, Requested: 6");
    }

    @Test
    void unknown_product_has_no_stock_information() {
        UUID unknown = UUID.randomUUID();
        Map<UUID, Integer> stock = Map.of(KURTA_ID, 10);

        ValidationReport report = validator.validateStockAvailability(
                List.of(new CartItemRequest(KURTA_ID, 10), new CartItemRequest(unknown, 1)),
                productId -> Optional.ofNullable(stock.get(productId)));

        assertThat(report.errors()).containsExactly("Product " + unknown + ": Stock information not available");
    }

    // --- Payment payload ---

    @Test
    void payment_payload_requires_every_gateway_field() {
        assertThat(validator.validatePaymentPayload(Map.of(), List.of("merchantTransactionId")).errors())
                .containsExactly("Payment data is required");
        assertThat(validator.validatePaymentPayload(
                Map.of("razorpay_order_id", "order_1", "razorpay_signature", " "),
                List.of("razorpay_order_id", "razorpay_payment_id", "razorpay_signature")).errors())
                .containsExactly("Missing razorpay_payment_id", "Missing razorpay_signature");
    }

    private List<String> phoneErrors(String phone) {
        return validator.validateShippingAddress(new AddressRequest(
                "Asha Rao", "asha@example.in", phone, "12 MG Road", null, "Bengaluru", "Karnataka", "560001"))
                .errors();
    }
}
