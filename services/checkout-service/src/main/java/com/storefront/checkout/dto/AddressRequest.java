package com.storefront.checkout.dto;

import com.storefront.checkout.entity.ShippingAddress;

public record AddressRequest(
        String name,
        String email,
        String phone,
        String line1,
        String line2,
        String city,
        String state,
        String pincode
) {
    public ShippingAddress toSnapshot() {
        return new ShippingAddress(
                name.trim(),
                email.trim(),
                phone.replaceAll("[\\s\\-()]", ""),
                line1.trim(),
                line2 == null || line2.isBlank() ? null : line2.trim(),
                city.trim(),
                state.trim(),
                pincode.trim()
        );
    }
}
