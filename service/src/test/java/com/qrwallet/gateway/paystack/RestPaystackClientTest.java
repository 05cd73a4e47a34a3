package com.qrwallet.gateway.paystack;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.WithdrawalType;
import com.qrwallet.api.response.BankAccountResponse;
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

import java.io.IOException;
import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestPaystackClientTest {

    private static final String BASE_URL = "https://api.paystack.co";

    private MockRestServiceServer server;
    private RestPaystackClient client;

    @BeforeEach
    void setUp() {
        WalletProperties properties = new WalletProperties();
        properties.getPaystack().setSecretKey("sk_test_key");
        RestTemplate restTemplate = new GatewayClientConfig().paystackRestTemplate(new RestTemplateBuilder(), properties);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestPaystackClient(restTemplate, properties);
    }

    @Test
    void verifyTransaction_Success() {
        server.expect(requestTo(BASE_URL + "/transaction/verify/T-1"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk_test_key"))
                .andRespond(withSuccess("""
                        {"status": true, "message": "Verification successful",
                         "data": {"status": "success", "amount": 25000, "currency": "GHS"}}
                        """, MediaType.APPLICATION_JSON));

        GatewayResult result = client.verifyTransaction("T-1");

        server.verify();
        assertThat(result.status()).isEqualTo(GatewayStatus.SUCCESS);
        assertThat(result.providerStatus()).isEqualTo("success");
        assertThat(result.message()).isEqualTo("Verification successful");
        assertThat(result.raw().path("amount").asLong()).isEqualTo(25000);
    }

    @Test
    void verifyTransaction_Abandoned() {
        server.expect(requestTo(BASE_URL + "/transaction/verify/T-2"))
                .andRespond(withSuccess("{\"status\": true, \"data\": {\"status\": \"abandoned\"}}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.verifyTransaction("T-2").status()).isEqualTo(GatewayStatus.FAILED);
    }

    @Test
    void initiateTransfer_SendsMinorUnitsAndReportsOtp() {
        server.expect(requestTo(BASE_URL + "/transfer"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("""
                        {"source": "balance", "amount": 150050, "recipient": "RCP_1", "reference": "WD-1"}
                        """))
                .andRespond(withSuccess("""
                        {"status": true, "message": "Transfer requires OTP to continue",
                         "data": {"status": "otp", "transfer_code": "TRF_1"}}
                        """, MediaType.APPLICATION_JSON));

        GatewayResult result = client.initiateTransfer(new BigDecimal("1500.50"), "RCP_1", "WD-1", "Wallet withdrawal");

        server.verify();
        assertThat(result.status()).isEqualTo(GatewayStatus.OTP_REQUIRED);
        assertThat(result.providerReference()).isEqualTo("TRF_1");
    }

    @Test
    void createTransferRecipient_RejectedByGateway() {
        server.expect(requestTo(BASE_URL + "/transferrecipient"))
                .andExpect(content().json("{\"type\": \"nuban\", \"bank_code\": \"058\"}"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"status\": false, \"message\": \"Account number is invalid\"}"));

        GatewayResult result = client.createTransferRecipient(WithdrawalType.BANK, "Ama Mensah", "0000000000",
                "058", "GHS");

        assertThat(result.status()).isEqualTo(GatewayStatus.FAILED);
        assertThat(result.providerReference()).isNull();
        assertThat(result.message()).isEqualTo("Account number is invalid");
    }

    @Test
    void unreachableGateway_RaisesServiceError() {
        server.expect(requestTo(BASE_URL + "/transfer/verify/WD-9"))
                .andRespond(withException(new IOException("Connection refused")));

        assertThatThrownBy(() -> client.verifyTransfer("WD-9"))
                .isInstanceOfSatisfying(WalletException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.SERVICE_PAYSTACK_ERROR));
    }

    @Test
    void resolveAccount_UnreachableGateway_ReturnsUnverified() {
        server.expect(requestTo(BASE_URL + "/bank/resolve?account_number=0123456789&bank_code=058"))
                .andRespond(withException(new IOException("Read timed out")));

        BankAccountResponse response = client.resolveAccount("0123456789", "058");

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("Account verification failed");
    }

    @Test
    void toMinorUnits_RoundsHalfUp() {
        assertThat(RestPaystackClient.toMinorUnits(new BigDecimal("10.005"))).isEqualTo(1001);
        assertThat(RestPaystackClient.toMinorUnits(new BigDecimal("7"))).isEqualTo(700);
        assertThat(RestPaystackClient.fromMinorUnits(1001)).isEqualByComparingTo("10.01");
    }
}
