package com.qrwallet.gateway.momo;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.MomoProduct;
import com.qrwallet.api.response.MomoBalanceResponse;
import com.qrwallet.config.GatewayClientConfig;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestMomoClientTest {

    private static final String BASE_URL = "https://sandbox.momodeveloper.mtn.com";
    private static final String REFERENCE_ID = "6f1c2a7e-0b7d-4d53-9c55-3f1f0f0f0a01";

    private MockRestServiceServer server;
    private RestMomoClient client;

    @BeforeEach
    void setUp() {
        WalletProperties properties = new WalletProperties();
        properties.getMomo().getCollections().setSubscriptionKey("col-sub-key");
        properties.getMomo().getCollections().setApiUser("col-user");
        properties.getMomo().getCollections().setApiKey("col-key");
        properties.getMomo().getDisbursements().setSubscriptionKey("dis-sub-key");
        properties.getMomo().getDisbursements().setApiUser("dis-user");
        properties.getMomo().getDisbursements().setApiKey("dis-key");
        RestTemplate restTemplate = new GatewayClientConfig().momoRestTemplate(new RestTemplateBuilder(), properties);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestMomoClient(restTemplate, properties);
    }

    private void expectToken(String product, String user, String key, String token) {
        String basic = Base64.getEncoder().encodeToString((user + ":" + key).getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(BASE_URL + "/" + product + "/token/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Basic " + basic))
                .andRespond(withSuccess("{\"access_token\": \"" + token + "\", \"expires_in\": 3600}",
                        MediaType.APPLICATION_JSON));
    }

    @Test
    void requestToPay_Accepted_IsPendingAndTokenIsReused() {
        expectToken("collection", "col-user", "col-key", "col-token");
        server.expect(requestTo(BASE_URL + "/collection/v1_0/requesttopay"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer col-token"))
                .andExpect(header("Ocp-Apim-Subscription-Key", "col-sub-key"))
                .andExpect(header("X-Reference-Id", REFERENCE_ID))
                .andExpect(header("X-Target-Environment", "sandbox"))
                .andExpect(headerDoesNotExist("X-Callback-Url"))
                .andExpect(content().json("""
                        {"amount": "75.5", "currency": "GHS", "externalId": "%s",
                         "payer": {"partyIdType": "MSISDN", "partyId": "233241234567"}}
                        """.formatted(REFERENCE_ID)))
                .andRespond(withStatus(HttpStatus.ACCEPTED));
        server.expect(requestTo(BASE_URL + "/collection/v1_0/requesttopay/" + REFERENCE_ID))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer col-token"))
                .andRespond(withSuccess("""
                        {"status": "SUCCESSFUL", "financialTransactionId": "FT-77"}
                        """, MediaType.APPLICATION_JSON));

        GatewayResult requested = client.requestToPay(REFERENCE_ID, new BigDecimal("75.50"), "GHS", "233241234567",
                "Add money to wallet", "Wallet top-up");
        GatewayResult status = client.getStatus(MomoProduct.COLLECTION, REFERENCE_ID);

        server.verify();
        assertThat(requested.status()).isEqualTo(GatewayStatus.PENDING);
        assertThat(requested.providerReference()).isEqualTo(REFERENCE_ID);
        assertThat(status.status()).isEqualTo(GatewayStatus.SUCCESS);
        assertThat(status.providerReference()).isEqualTo("FT-77");
    }

    @Test
    void transfer_Rejected_IsFailed() {
        expectToken("disbursement", "dis-user", "dis-key", "dis-token");
        server.expect(requestTo(BASE_URL + "/disbursement/v1_0/transfer"))
                .andExpect(content().json("{\"payee\": {\"partyId\": \"233241234567\"}}"))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\": \"RESOURCE_ALREADY_EXIST\"}"));

        GatewayResult result = client.transfer(REFERENCE_ID, new BigDecimal("20"), "GHS", "233241234567",
                "Wallet withdrawal", "Withdrawal from wallet");

        assertThat(result.status()).isEqualTo(GatewayStatus.FAILED);
        assertThat(result.message()).contains("RESOURCE_ALREADY_EXIST");
    }

    @Test
    void getStatus_FailedWithReason() {
        expectToken("disbursement", "dis-user", "dis-key", "dis-token");
        server.expect(requestTo(BASE_URL + "/disbursement/v1_0/transfer/" + REFERENCE_ID))
                .andRespond(withSuccess("{\"status\": \"FAILED\", \"reason\": \"PAYEE_NOT_FOUND\"}",
                        MediaType.APPLICATION_JSON));

        GatewayResult result = client.getStatus(MomoProduct.DISBURSEMENT, REFERENCE_ID);

        assertThat(result.status()).isEqualTo(GatewayStatus.FAILED);
        assertThat(result.providerStatus()).isEqualTo("FAILED");
        assertThat(result.message()).contains("PAYEE_NOT_FOUND");
    }

    @Test
    void getStatus_UnknownReference_IsInconclusive() {
        expectToken("collection", "col-user", "col-key", "col-token");
        server.expect(requestTo(BASE_URL + "/collection/v1_0/requesttopay/" + REFERENCE_ID))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.getStatus(MomoProduct.COLLECTION, REFERENCE_ID).status()).isEqualTo(GatewayStatus.UNKNOWN);
    }

    @Test
    void getBalance() {
        expectToken("collection", "col-user", "col-key", "col-token");
        server.expect(requestTo(BASE_URL + "/collection/v1_0/account/balance"))
                .andRespond(withSuccess("{\"availableBalance\": \"1250.00\", \"currency\": \"EUR\"}",
                        MediaType.APPLICATION_JSON));

        MomoBalanceResponse balance = client.getBalance(MomoProduct.COLLECTION);

        assertThat(balance.availableBalance()).isEqualTo("1250.00");
        assertThat(balance.currency()).isEqualTo("EUR");
    }

    @Test
    void tokenRejected_RaisesServiceError() {
        server.expect(requestTo(BASE_URL + "/collection/token/"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\": \"login_failed\"}"));

        assertThatThrownBy(() -> client.getBalance(MomoProduct.COLLECTION))
                .isInstanceOfSatisfying(WalletException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.SERVICE_MOMO_ERROR));
    }
}
