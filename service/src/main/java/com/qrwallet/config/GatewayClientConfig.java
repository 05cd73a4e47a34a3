package com.qrwallet.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP clients for the payment gateways and the exchange-rate source.
 *
 * <p>Non-2xx responses are not turned into exceptions: the adapters inspect status codes
 * themselves (mobile money signals acceptance with 202).
 */
@Configuration
public class GatewayClientConfig {

    @Bean
    public RestTemplate paystackRestTemplate(RestTemplateBuilder builder, WalletProperties properties) {
        return builder
                .rootUri(properties.getPaystack().getBaseUrl())
                .setConnectTimeout(properties.getPaystack().getConnectTimeout())
                .setReadTimeout(properties.getPaystack().getReadTimeout())
                .errorHandler(new PassThroughErrorHandler())
                .build();
    }

    @Bean
    public RestTemplate momoRestTemplate(RestTemplateBuilder builder, WalletProperties properties) {
        return builder
                .rootUri(properties.getMomo().getBaseUrl())
                .setConnectTimeout(properties.getMomo().getConnectTimeout())
                .setReadTimeout(properties.getMomo().getReadTimeout())
                .errorHandler(new PassThroughErrorHandler())
                .build();
    }

    @Bean
    public RestTemplate exchangeRateRestTemplate(RestTemplateBuilder builder) {
        return builder.build();
    }
}
