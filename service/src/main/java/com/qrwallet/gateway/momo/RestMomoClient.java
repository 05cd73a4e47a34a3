package com.qrwallet.gateway.momo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.MomoProduct;
import com.qrwallet.api.response.MomoBalanceResponse;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link MomoClient} over the provider's REST API.
 *
 * <p>Access tokens are obtained per product with basic authentication and cached for slightly less than their
 * one-hour lifetime.
 */
@Component
@Slf4j
public class RestMomoClient implements MomoClient {

    static final String GATEWAY = "momo";
    private static final String SUBSCRIPTION_KEY_HEADER = "Ocp-Apim-Subscription-Key";

    private final RestTemplate restTemplate;
    private final WalletProperties properties;
    private final Cache<MomoProduct, String> tokens = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(55))
            .build();

    public RestMomoClient(@Qualifier("momoRestTemplate") RestTemplate restTemplate, WalletProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public GatewayResult requestToPay(String referenceId, BigDecimal amount, String currency, String phoneNumber,
                                      String payerMessage, String payeeNote) {
        Map<String, Object> body = paymentBody(referenceId, amount, currency, phoneNumber, payerMessage, payeeNote);
        body.put("payer", party(phoneNumber));
        return submit(MomoProduct.COLLECTION, "/collection/v1_0/requesttopay", referenceId, body);
    }

    @Override
    public GatewayResult transfer(String referenceId, BigDecimal amount, String currency, String phoneNumber,
                                  String payerMessage, String payeeNote) {
        Map<String, Object> body = paymentBody(referenceId, amount, currency, phoneNumber, payerMessage, payeeNote);
        body.put("payee", party(phoneNumber));
        return submit(MomoProduct.DISBURSEMENT, "/disbursement/v1_0/transfer", referenceId, body);
    }

    @Override
    public GatewayResult getStatus(MomoProduct product, String referenceId) {
        String path = product == MomoProduct.COLLECTION
                ? "/collection/v1_0/requesttopay/{referenceId}"
                : "/disbursement/v1_0/transfer/{referenceId}";
        ResponseEntity<JsonNode> response = exchange(product, HttpMethod.GET, path, null, null, "getStatus", referenceId);
        JsonNode body = bodyOf(response);

        if (!response.getStatusCode().is2xxSuccessful()) {
            log.warn("MoMo status query rejected: product={}, referenceId={}, httpStatus={}",
                    product.value(), referenceId, response.getStatusCode().value());
            return new GatewayResult(GATEWAY, GatewayStatus.UNKNOWN, null, null, body.toString(), body);
        }

        String providerStatus = text(body, "status");
        GatewayStatus status = switch (providerStatus == null ? "" : providerStatus) {
            case "SUCCESSFUL" -> GatewayStatus.SUCCESS;
            case "FAILED", "REJECTED", "TIMEOUT" -> GatewayStatus.FAILED;
            case "PENDING" -> GatewayStatus.PENDING;
            default -> GatewayStatus.UNKNOWN;
        };
        JsonNode reason = body.get("reason");
        String message = reason == null || reason.isNull() ? null : reason.toString();
        return new GatewayResult(GATEWAY, status, providerStatus, text(body, "financialTransactionId"), message, body);
    }

    @Override
    public MomoBalanceResponse getBalance(MomoProduct product) {
        ResponseEntity<JsonNode> response = exchange(product, HttpMethod.GET,
                "/" + product.value() + "/v1_0/account/balance", null, null, "getBalance");
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw WalletException.service(ErrorCode.SERVICE_MOMO_ERROR,
                    new IllegalStateException("Balance query rejected with HTTP " + response.getStatusCode().value()),
                    Map.of("operation", "getBalance"));
        }
        JsonNode body = bodyOf(response);
        return new MomoBalanceResponse(product, text(body, "availableBalance"), text(body, "currency"));
    }

    private GatewayResult submit(MomoProduct product, String path, String referenceId, Map<String, Object> body) {
        ResponseEntity<JsonNode> response = exchange(product, HttpMethod.POST, path, body, referenceId,
                product == MomoProduct.COLLECTION ? "requestToPay" : "transfer");
        JsonNode responseBody = bodyOf(response);

        if (response.getStatusCode().value() == HttpStatus.ACCEPTED.value()) {
            return new GatewayResult(GATEWAY, GatewayStatus.PENDING, "PENDING", referenceId, null, responseBody);
        }
        log.warn("MoMo request rejected: product={}, referenceId={}, httpStatus={}, body={}",
                product.value(), referenceId, response.getStatusCode().value(), responseBody);
        return new GatewayResult(GATEWAY, GatewayStatus.FAILED, "FAILED", referenceId, responseBody.toString(),
                responseBody);
    }

    private ResponseEntity<JsonNode> exchange(MomoProduct product, HttpMethod method, String path, Object body,
                                              String referenceId, String operation, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(accessToken(product));
        headers.set(SUBSCRIPTION_KEY_HEADER, credentials(product).getSubscriptionKey());
        headers.set("X-Target-Environment", properties.getMomo().getTargetEnvironment());
        if (referenceId != null) {
            headers.set("X-Reference-Id", referenceId);
            String callbackUrl = callbackUrl();
            if (callbackUrl != null) {
                headers.set("X-Callback-Url", callbackUrl);
            }
        }

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    path,
                    method,
                    new HttpEntity<>(body, headers),
                    JsonNode.class,
                    uriVariables
            );
            log.info("MoMo response: operation={}, referenceId={}, httpStatus={}",
                    operation, referenceId, response.getStatusCode().value());
            return response;
        } catch (RestClientException e) {
            log.error("MoMo call failed: operation={}, referenceId={}", operation, referenceId, e);
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("operation", operation);
            if (referenceId != null) {
                context.put("referenceId", referenceId);
            }
            throw WalletException.service(ErrorCode.SERVICE_MOMO_ERROR, e, context);
        }
    }

    private String accessToken(MomoProduct product) {
        return tokens.get(product, this::fetchToken);
    }

    private String fetchToken(MomoProduct product) {
        WalletProperties.Credentials credentials = credentials(product);
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(credentials.getApiUser(), credentials.getApiKey());
        headers.set(SUBSCRIPTION_KEY_HEADER, credentials.getSubscriptionKey());

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    "/" + product.value() + "/token/",
                    HttpMethod.POST,
                    new HttpEntity<>(null, headers),
                    JsonNode.class
            );
            String token = text(bodyOf(response), "access_token");
            if (!response.getStatusCode().is2xxSuccessful() || token == null) {
                throw WalletException.service(ErrorCode.SERVICE_MOMO_ERROR,
                        new IllegalStateException("Token request rejected with HTTP " + response.getStatusCode().value()),
                        Map.of("operation", "token", "product", product.value()));
            }
            log.debug("MoMo access token obtained: product={}", product.value());
            return token;
        } catch (RestClientException e) {
            log.error("MoMo token request failed: product={}", product.value(), e);
            throw WalletException.service(ErrorCode.SERVICE_MOMO_ERROR, e,
                    Map.of("operation", "token", "product", product.value()));
        }
    }

    /**
     * Callback URL with the shared webhook token; the sandbox does not deliver callbacks.
     */
    private String callbackUrl() {
        WalletProperties.Momo momo = properties.getMomo();
        if ("sandbox".equals(momo.getTargetEnvironment()) || !StringUtils.hasText(momo.getCallbackUrl())) {
            return null;
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(momo.getCallbackUrl());
        if (StringUtils.hasText(momo.getWebhookSecret())) {
            builder.queryParam("token", momo.getWebhookSecret());
        }
        return builder.toUriString();
    }

    private WalletProperties.Credentials credentials(MomoProduct product) {
        return product == MomoProduct.COLLECTION
                ? properties.getMomo().getCollections()
                : properties.getMomo().getDisbursements();
    }

    private static Map<String, Object> paymentBody(String referenceId, BigDecimal amount, String currency,
                                                   String phoneNumber, String payerMessage, String payeeNote) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", amount.stripTrailingZeros().toPlainString());
        body.put("currency", currency);
        body.put("externalId", referenceId);
        body.put("payerMessage", payerMessage);
        body.put("payeeNote", payeeNote);
        return body;
    }

    private static Map<String, Object> party(String phoneNumber) {
        Map<String, Object> party = new LinkedHashMap<>();
        party.put("partyIdType", "MSISDN");
        party.put("partyId", phoneNumber);
        return party;
    }

    private static JsonNode bodyOf(ResponseEntity<JsonNode> response) {
        return response.getBody() == null ? JsonNodeFactory.instance.objectNode() : response.getBody();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
