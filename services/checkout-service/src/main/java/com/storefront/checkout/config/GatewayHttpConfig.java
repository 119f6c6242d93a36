package com.storefront.checkout.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class GatewayHttpConfig {

    /**
     * Client shared by all payment gateways. A call that exceeds either timeout
     * fails like any other provider error.
     */
    @Bean
    public RestClient gatewayRestClient(RestClient.Builder builder,
                                        @Value("${checkout.gateway.connect-timeout:5s}") Duration connectTimeout,
                                        @Value("${checkout.gateway.read-timeout:15s}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return builder.requestFactory(requestFactory).build();
    }
}
