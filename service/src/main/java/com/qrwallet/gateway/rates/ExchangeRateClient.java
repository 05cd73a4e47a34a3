package com.qrwallet.gateway.rates;

import com.fasterxml.jackson.databind.JsonNode;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches USD based exchange rates from the configured public source.
 */
@Component
@Slf4j
public class ExchangeRateClient {

    private final RestTemplate restTemplate;
    private final WalletProperties properties;

    public ExchangeRateClient(@Qualifier("exchangeRateRestTemplate") RestTemplate restTemplate,
                              WalletProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    /**
     * @return Units of each currency per one US dollar, as published by the source
     * @throws WalletException SERVICE_UNAVAILABLE if the source cannot be reached or returns no rates
     */
    public Map<String, BigDecimal> fetchUsdRates() {
        String url = properties.getExchangeRates().getSourceUrl();
        JsonNode body;
        try {
            body = restTemplate.getForObject(url, JsonNode.class);
        } catch (RestClientException e) {
            throw WalletException.service(ErrorCode.SERVICE_UNAVAILABLE, e, Map.of("operation", "fetchExchangeRates"));
        }

        JsonNode rates = body == null ? null : body.get("rates");
        if (rates == null || !rates.isObject() || rates.isEmpty()) {
            log.error("Exchange rate source returned no rates: source={}", properties.getExchangeRates().getSourceName());
            throw WalletException.service(ErrorCode.SERVICE_UNAVAILABLE,
                    new IllegalStateException("No rates in response"), Map.of("operation", "fetchExchangeRates"));
        }

        Map<String, BigDecimal> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = rates.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                result.put(field.getKey(), field.getValue().decimalValue());
            }
        }
        return result;
    }
}
