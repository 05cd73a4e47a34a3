package com.qrwallet.gateway.paystack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.WithdrawalType;
import com.qrwallet.api.response.BankAccountResponse;
import com.qrwallet.api.response.BankResponse;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PaystackClient} over the gateway's REST API, authenticated with the secret key as bearer token.
 */
@Component
@Slf4j
public class RestPaystackClient implements PaystackClient {

    static final String GATEWAY = "paystack";

    private final RestTemplate restTemplate;
    private final WalletProperties properties;

    public RestPaystackClient(@Qualifier("paystackRestTemplate") RestTemplate restTemplate, WalletProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public GatewayResult createTransferRecipient(WithdrawalType type, String name, String accountNumber,
                                                 String bankCode, String currency) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type == WithdrawalType.MOBILE_MONEY ? "mobile_money" : "nuban");
        body.put("name", name);
        body.put("account_number", accountNumber);
        body.put("bank_code", bankCode);
        body.put("currency", currency);

        JsonNode response = call(HttpMethod.POST, "/transferrecipient", body, "createTransferRecipient");
        GatewayStatus status = isOk(response) ? GatewayStatus.SUCCESS : GatewayStatus.FAILED;
        return result(response, status, text(data(response), "recipient_code"));
    }

    @Override
    public GatewayResult initiateTransfer(BigDecimal amount, String recipientCode, String reference, String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("source", "balance");
        body.put("amount", toMinorUnits(amount));
        body.put("recipient", recipientCode);
        body.put("reference", reference);
        body.put("reason", reason);

        JsonNode response = call(HttpMethod.POST, "/transfer", body, "initiateTransfer");
        if (!isOk(response)) {
            return result(response, GatewayStatus.FAILED, null);
        }
        JsonNode data = data(response);
        return result(response, mapTransferStatus(text(data, "status")), text(data, "transfer_code"));
    }

    @Override
    public GatewayResult finalizeTransfer(String transferCode, String otp) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("transfer_code", transferCode);
        body.put("otp", otp);

        JsonNode response = call(HttpMethod.POST, "/transfer/finalize_transfer", body, "finalizeTransfer");
        if (!isOk(response)) {
            return result(response, GatewayStatus.FAILED, transferCode);
        }
        return result(response, mapTransferStatus(text(data(response), "status")), transferCode);
    }

    @Override
    public GatewayResult verifyTransaction(String reference) {
        JsonNode response = call(HttpMethod.GET, "/transaction/verify/{reference}", null, "verifyTransaction", reference);
        if (!isOk(response)) {
            return result(response, GatewayStatus.UNKNOWN, reference);
        }
        String status = text(data(response), "status");
        GatewayStatus normalized = switch (status == null ? "" : status) {
            case "success" -> GatewayStatus.SUCCESS;
            case "failed", "abandoned", "reversed" -> GatewayStatus.FAILED;
            case "ongoing", "pending", "processing", "queued", "send_otp", "pay_offline" -> GatewayStatus.PENDING;
            default -> GatewayStatus.UNKNOWN;
        };
        return result(response, normalized, reference);
    }

    @Override
    public GatewayResult verifyTransfer(String reference) {
        JsonNode response = call(HttpMethod.GET, "/transfer/verify/{reference}", null, "verifyTransfer", reference);
        if (!isOk(response)) {
            return result(response, GatewayStatus.UNKNOWN, reference);
        }
        JsonNode data = data(response);
        return result(response, mapTransferStatus(text(data, "status")), text(data, "transfer_code"));
    }

    @Override
    public GatewayResult initializeTransaction(String email, BigDecimal amount, String currency, String reference,
                                               Map<String, Object> metadata) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("amount", toMinorUnits(amount));
        body.put("currency", currency);
        body.put("reference", reference);
        body.put("metadata", metadata);

        JsonNode response = call(HttpMethod.POST, "/transaction/initialize", body, "initializeTransaction");
        GatewayStatus status = isOk(response) ? GatewayStatus.PENDING : GatewayStatus.FAILED;
        return result(response, status, text(data(response), "reference"));
    }

    @Override
    public GatewayResult chargeMobileMoney(String email, BigDecimal amount, String currency, String phone,
                                           String provider, String reference, Map<String, Object> metadata) {
        Map<String, Object> mobileMoney = new LinkedHashMap<>();
        mobileMoney.put("phone", phone);
        mobileMoney.put("provider", provider);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("amount", toMinorUnits(amount));
        body.put("currency", currency);
        body.put("mobile_money", mobileMoney);
        body.put("reference", reference);
        body.put("metadata", metadata);

        JsonNode response = call(HttpMethod.POST, "/charge", body, "chargeMobileMoney");
        if (!isOk(response)) {
            return result(response, GatewayStatus.FAILED, reference);
        }
        String status = text(data(response), "status");
        return result(response, "success".equals(status) ? GatewayStatus.SUCCESS : GatewayStatus.PENDING, reference);
    }

    @Override
    public List<BankResponse> listBanks(String country) {
        JsonNode response = call(HttpMethod.GET, "/bank?country={country}", null, "listBanks", country);
        if (!isOk(response)) {
            throw WalletException.service(ErrorCode.SERVICE_PAYSTACK_ERROR,
                    new IllegalStateException("Failed to fetch banks"), Map.of("operation", "listBanks"));
        }
        List<BankResponse> banks = new ArrayList<>();
        for (JsonNode bank : data(response)) {
            banks.add(new BankResponse(text(bank, "name"), text(bank, "code"), text(bank, "type")));
        }
        return banks;
    }

    @Override
    public BankAccountResponse resolveAccount(String accountNumber, String bankCode) {
        JsonNode response;
        try {
            response = call(HttpMethod.GET, "/bank/resolve?account_number={accountNumber}&bank_code={bankCode}",
                    null, "resolveAccount", accountNumber, bankCode);
        } catch (WalletException e) {
            log.warn("Account resolution unavailable: bankCode={}", bankCode);
            return new BankAccountResponse(false, null, null, null, "Account verification failed");
        }
        if (!isOk(response)) {
            return new BankAccountResponse(false, null, null, null, "Could not verify account");
        }
        JsonNode data = data(response);
        Long bankId = data.hasNonNull("bank_id") ? data.get("bank_id").asLong() : null;
        return new BankAccountResponse(true, text(data, "account_name"), text(data, "account_number"), bankId, null);
    }

    private JsonNode call(HttpMethod method, String path, Object body, String operation, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getPaystack().getSecretKey());

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    path,
                    method,
                    new HttpEntity<>(body, headers),
                    JsonNode.class,
                    uriVariables
            );
            JsonNode responseBody = response.getBody();
            log.info("Paystack response: operation={}, httpStatus={}, status={}",
                    operation, response.getStatusCode().value(), responseBody == null ? null : responseBody.path("status"));
            return responseBody == null ? JsonNodeFactory.instance.objectNode() : responseBody;
        } catch (RestClientException e) {
            log.error("Paystack call failed: operation={}", operation, e);
            throw WalletException.service(ErrorCode.SERVICE_PAYSTACK_ERROR, e, Map.of("operation", operation));
        }
    }

    private static GatewayStatus mapTransferStatus(String status) {
        if (status == null) {
            return GatewayStatus.UNKNOWN;
        }
        return switch (status) {
            case "success" -> GatewayStatus.SUCCESS;
            case "otp" -> GatewayStatus.OTP_REQUIRED;
            case "pending", "received", "processing", "queued" -> GatewayStatus.PENDING;
            case "failed", "reversed", "rejected", "abandoned" -> GatewayStatus.FAILED;
            default -> GatewayStatus.UNKNOWN;
        };
    }

    private static GatewayResult result(JsonNode response, GatewayStatus status, String providerReference) {
        JsonNode data = data(response);
        return new GatewayResult(GATEWAY, status, text(data, "status"), providerReference,
                text(response, "message"), data);
    }

    private static boolean isOk(JsonNode response) {
        return response.path("status").asBoolean(false);
    }

    private static JsonNode data(JsonNode response) {
        JsonNode data = response.get("data");
        return data == null || data.isNull() ? JsonNodeFactory.instance.objectNode() : data;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Converts a minor-unit amount reported by the gateway to major units.
     */
    public static BigDecimal fromMinorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, 2);
    }
}
