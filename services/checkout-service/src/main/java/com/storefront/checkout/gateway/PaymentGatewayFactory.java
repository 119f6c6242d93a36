package com.storefront.checkout.gateway;

import com.storefront.checkout.exception.GatewayUnavailableException;
import com.storefront.checkout.gateway.phonepe.PhonePeGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class PaymentGatewayFactory {

    private static final Logger log = LoggerFactory.getLogger(PaymentGatewayFactory.class);

    private final Map<String, PaymentGateway> gateways = new LinkedHashMap<>();
    private final String defaultGateway;

    public PaymentGatewayFactory(List<PaymentGateway> gateways,
                                 @Value("${checkout.payment.default-gateway:" + PhonePeGateway.NAME + "}") String defaultGateway) {
        for (PaymentGateway gateway : gateways) {
            this.gateways.put(gateway.name(), gateway);
        }
        this.defaultGateway = (defaultGateway == null || defaultGateway.isBlank()
                ? PhonePeGateway.NAME : defaultGateway).toLowerCase(Locale.ROOT);
        log.info("Payment gateways registered: {}, default={}", this.gateways.keySet(), this.defaultGateway);
    }

    /**
     * @throws GatewayUnavailableException when the name is unknown or its credentials are missing
     */
    public PaymentGateway getGateway(String name) {
        if (name == null || name.isBlank()) {
            return getDefaultGateway();
        }
        PaymentGateway gateway = gateways.get(name.toLowerCase(Locale.ROOT));
        if (gateway == null) {
            throw new GatewayUnavailableException("Unsupported payment gateway: " + name
                    + ". Supported gateways: " + String.join(", ", gateways.keySet()));
        }
        if (!gateway.isConfigured()) {
            throw new GatewayUnavailableException("Payment gateway " + name + " is not configured");
        }
        return gateway;
    }

    public PaymentGateway getDefaultGateway() {
        return getGateway(defaultGateway);
    }

    public List<String> getAvailableGateways() {
        return List.copyOf(gateways.keySet());
    }
}
