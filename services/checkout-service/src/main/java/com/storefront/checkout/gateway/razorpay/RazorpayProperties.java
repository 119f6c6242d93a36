package com.storefront.checkout.gateway.razorpay;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "checkout.gateways.razorpay")
public record RazorpayProperties(
        String keyId,
        String keySecret,
        String webhookSecret,
        @DefaultValue("https://api.razorpay.com") String baseUrl,
        @DefaultValue("Storefront") String merchantName,
        @DefaultValue("#3399cc") String themeColor
) {
    public boolean isComplete() {
        return hasText(keyId) && hasText(keySecret);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
