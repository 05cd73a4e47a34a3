package com.qrwallet.tests;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qrwallet.TestBase;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.request.ChargeMobileMoneyRequest;
import com.qrwallet.api.request.InitializeTransactionRequest;
import com.qrwallet.api.request.VerifyPaymentRequest;
import com.qrwallet.api.response.BankAccountResponse;
import com.qrwallet.api.response.BankResponse;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayStatus;
import com.qrwallet.model.AuditResult;
import com.qrwallet.model.Payment;
import com.qrwallet.repository.AuditLogRepository;
import com.qrwallet.repository.PaymentRepository;
import com.qrwallet.repository.TransactionReceiptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for wallet top-ups through the card gateway.
 *
 * <p>Tests verify:
 * <ul>
 *   <li>PAY-001: Client-side verification credits a settled charge exactly once and audits failures</li>
 *   <li>PAY-002: Hosted checkout records the pending payment</li>
 *   <li>PAY-003: Mobile-money charges credit at once only when settled</li>
 *   <li>PAY-004: Bank directory pass-through</li>
 * </ul>
 */
@DisplayName("7. Payment Tests")
public class PaymentTest extends TestBase {

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private TransactionReceiptRepository receiptRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    private String userId;

    @BeforeEach
    public void setupWallet() {
        userId = newUserId();
        createVerifiedWallet(userId, "Efua Sutherland", "GHS", "100.00");
    }

    private ObjectNode chargeData(long amountMinor, String payer) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("status", "success");
        data.put("amount", amountMinor);
        data.put("currency", "GHS");
        data.put("channel", "card");
        data.putObject("metadata").put("userId", payer);
        return data;
    }

    @Test
    @DisplayName("PAY-001: Settled charge is credited once")
    void verifyPayment_Twice_CreditsOnce() throws Exception {
        when(paystackClient.verifyTransaction("T-100"))
                .thenReturn(gatewayResult(GatewayStatus.SUCCESS, "success", "T-100", chargeData(25_000, userId)));

        mockMvc.perform(postAs(userId, "/api/v1/payments/verify").content(json(new VerifyPaymentRequest("T-100"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.alreadyProcessed").value(false))
                .andExpect(jsonPath("$.currency").value("GHS"))
                .andExpect(jsonPath("$.message").value("Payment verified successfully"));

        mockMvc.perform(postAs(userId, "/api/v1/payments/verify").content(json(new VerifyPaymentRequest("T-100"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alreadyProcessed").value(true))
                .andExpect(jsonPath("$.message").value("Payment already processed"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("350");
        Payment payment = paymentRepository.findById("T-100").orElseThrow();
        assertThat(payment.isProcessed()).isTrue();
        assertThat(payment.getCreditedAmount()).isEqualByComparingTo("250");
        assertThat(receiptRepository.findByTransactionId("T-100")).hasSize(1);
    }

    @Test
    @DisplayName("PAY-001: Charge not settled at the gateway")
    void verifyPayment_NotSuccessful_CreditsNothing() throws Exception {
        when(paystackClient.verifyTransaction("T-101"))
                .thenReturn(gatewayResult(GatewayStatus.FAILED, "abandoned", "T-101"));

        mockMvc.perform(postAs(userId, "/api/v1/payments/verify").content(json(new VerifyPaymentRequest("T-101"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Payment verification failed"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("100");
        assertThat(paymentRepository.findById("T-101")).isEmpty();
    }

    @Test
    @DisplayName("PAY-001: Another user's payment")
    void verifyPayment_OtherUsersCharge_ShouldReturn403() throws Exception {
        String payer = newUserId();
        createVerifiedWallet(payer, "Kojo Antwi", "GHS", null);
        when(paystackClient.verifyTransaction("T-102"))
                .thenReturn(gatewayResult(GatewayStatus.SUCCESS, "success", "T-102", chargeData(10_000, payer)));

        mockMvc.perform(postAs(userId, "/api/v1/payments/verify").content(json(new VerifyPaymentRequest("T-102"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("AUTH_PERMISSION_DENIED"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("100");
        assertThat(balanceOf(payer)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("PAY-001: Unreachable gateway is audited as a failure")
    void verifyPayment_GatewayUnreachable_AuditsFailure() throws Exception {
        when(paystackClient.verifyTransaction("T-103"))
                .thenThrow(WalletException.service(ErrorCode.SERVICE_PAYSTACK_ERROR,
                        new IllegalStateException("connect timed out"), Map.of("operation", "verifyTransaction")));

        mockMvc.perform(postAs(userId, "/api/v1/payments/verify").content(json(new VerifyPaymentRequest("T-103"))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SERVICE_PAYSTACK_ERROR"));

        assertThat(auditLogRepository.findByUserIdAndOperationOrderByTimestampAsc(userId, "verifyPayment"))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getResult()).isEqualTo(AuditResult.FAILURE);
                    assertThat(entry.getMetadata()).contains("T-103");
                    assertThat(entry.getError()).startsWith("SERVICE_PAYSTACK_ERROR");
                });
    }

    @Test
    @DisplayName("PAY-001: Unexpected error becomes a generic internal error")
    void verifyPayment_UnexpectedError_ShouldReturn500() throws Exception {
        when(paystackClient.verifyTransaction("T-104")).thenThrow(new IllegalStateException("malformed response"));

        mockMvc.perform(postAs(userId, "/api/v1/payments/verify").content(json(new VerifyPaymentRequest("T-104"))))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("SYSTEM_INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("Payment verification failed."));

        assertThat(balanceOf(userId)).isEqualByComparingTo("100");
        assertThat(auditLogRepository.findByUserIdAndOperationOrderByTimestampAsc(userId, "verifyPayment"))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getResult()).isEqualTo(AuditResult.FAILURE);
                    assertThat(entry.getError()).isEqualTo("malformed response");
                });
    }

    @Test
    @DisplayName("PAY-002: Hosted checkout")
    void initializeTransaction_ShouldRecordPendingPayment() throws Exception {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("authorization_url", "https://checkout.example.com/abc");
        data.put("access_code", "abc");
        when(paystackClient.initializeTransaction(eq("efua@example.com"), any(), eq("GHS"), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, null, null, data));

        mockMvc.perform(postAs(userId, "/api/v1/payments/initialize")
                        .content(json(new InitializeTransactionRequest("efua@example.com", new BigDecimal("50"), "GHS"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authorizationUrl").value("https://checkout.example.com/abc"))
                .andExpect(jsonPath("$.accessCode").value("abc"));

        assertThat(paymentRepository.findAll()).singleElement().satisfies(payment -> {
            assertThat(payment.getUserId()).isEqualTo(userId);
            assertThat(payment.isProcessed()).isFalse();
            assertThat(payment.getGatewayStatus()).isEqualTo("pending");
            assertThat(payment.getChannel()).isEqualTo("card");
        });
        assertThat(balanceOf(userId)).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("PAY-002: Non-positive amount")
    void initializeTransaction_ZeroAmount_ShouldReturn400() throws Exception {
        mockMvc.perform(postAs(userId, "/api/v1/payments/initialize")
                        .content(json(new InitializeTransactionRequest("efua@example.com", BigDecimal.ZERO, "GHS"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TXN_AMOUNT_INVALID"));

        verify(paystackClient, never()).initializeTransaction(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("PAY-003: Charge settled immediately")
    void chargeMobileMoney_Settled_CreditsAtOnce() throws Exception {
        when(paystackClient.chargeMobileMoney(any(), any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.SUCCESS, "success", null));
        ChargeMobileMoneyRequest request = new ChargeMobileMoneyRequest("efua@example.com", new BigDecimal("40"),
                "GHS", "mtn", "0241234567", newIdempotencyKey());

        mockMvc.perform(postAs(userId, "/api/v1/payments/mobile-money").content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completed").value(true))
                .andExpect(jsonPath("$.message").value("Payment successful!"));
        mockMvc.perform(postAs(userId, "/api/v1/payments/mobile-money").content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.idempotentReplay").value(true));

        verify(paystackClient, times(1)).chargeMobileMoney(any(), any(), any(), any(), any(), any(), any());
        assertThat(balanceOf(userId)).isEqualByComparingTo("140");
    }

    @Test
    @DisplayName("PAY-003: Charge awaiting approval")
    void chargeMobileMoney_Pending_WaitsForWebhook() throws Exception {
        when(paystackClient.chargeMobileMoney(any(), any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "pay_offline", null));

        mockMvc.perform(postAs(userId, "/api/v1/payments/mobile-money")
                        .content(json(new ChargeMobileMoneyRequest("efua@example.com", new BigDecimal("40"),
                                "GHS", "mtn", "0241234567", newIdempotencyKey()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completed").value(false))
                .andExpect(jsonPath("$.status").value("pay_offline"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("100");
        assertThat(paymentRepository.findAll()).singleElement()
                .satisfies(payment -> assertThat(payment.getGatewayStatus()).isEqualTo("pay_offline"));
    }

    @Test
    @DisplayName("PAY-003: Charge declined")
    void chargeMobileMoney_Failed_ShouldReturn503() throws Exception {
        when(paystackClient.chargeMobileMoney(any(), any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.FAILED, "failed", null));

        mockMvc.perform(postAs(userId, "/api/v1/payments/mobile-money")
                        .content(json(new ChargeMobileMoneyRequest("efua@example.com", new BigDecimal("40"),
                                "GHS", "mtn", "0241234567", newIdempotencyKey()))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SERVICE_PAYSTACK_ERROR"));

        assertThat(paymentRepository.findAll()).singleElement()
                .satisfies(payment -> assertThat(payment.getGatewayStatus()).isEqualTo("failed"));
    }

    @Test
    @DisplayName("PAY-004: Bank list and account resolution")
    void banksAndAccountResolution() throws Exception {
        when(paystackClient.listBanks("ghana"))
                .thenReturn(List.of(new BankResponse("GCB Bank", "040100", "ghipss")));
        when(paystackClient.resolveAccount("0123456789", "040100"))
                .thenReturn(new BankAccountResponse(true, "EFUA SUTHERLAND", "0123456789", 7L, null));

        mockMvc.perform(getAs(userId, "/api/v1/payments/banks").param("country", "ghana"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].code").value("040100"));

        mockMvc.perform(getAs(userId, "/api/v1/payments/banks/resolve")
                        .param("accountNumber", "0123456789")
                        .param("bankCode", "040100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountName").value("EFUA SUTHERLAND"));
    }
}
