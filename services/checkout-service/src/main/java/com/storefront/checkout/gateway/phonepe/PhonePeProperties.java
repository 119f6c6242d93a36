package com.storefront.checkout.gateway.phonepe;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "checkout.gateways.phonepe")
public record PhonePeProperties(
        String merchantId,
        String saltKey,
        String saltIndex,
        @DefaultValue("https://api-preprod.phonepe.com/apis/pg-sandbox") String baseUrl,
        String redirectUrl,
        String callbackUrl
) {
    public boolean isComplete() {
        return hasText(merchantId) && hasText(saltKey) && hasText(saltIndex);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
