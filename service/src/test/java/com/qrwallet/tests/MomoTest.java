package com.qrwallet.tests;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qrwallet.TestBase;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.MomoProduct;
import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.api.request.MomoPaymentRequest;
import com.qrwallet.api.response.MomoTransactionResponse;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayStatus;
import com.qrwallet.model.MomoTransaction;
import com.qrwallet.repository.MomoTransactionRepository;
import com.qrwallet.repository.TransactionReceiptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for mobile-money collections, disbursements and provider callbacks.
 *
 * <p>Tests verify:
 * <ul>
 *   <li>MOMO-001: A collection credits the wallet once, when the provider confirms it</li>
 *   <li>MOMO-002: A disbursement debits up front and is refunded once when it fails</li>
 *   <li>MOMO-003: Callbacks need the shared token and a reference issued by this service</li>
 *   <li>MOMO-004: Status checks are limited to the owner of the transaction</li>
 * </ul>
 */
@DisplayName("4. Mobile Money Tests")
public class MomoTest extends TestBase {

    @Autowired
    private MomoTransactionRepository momoTransactionRepository;

    @Autowired
    private TransactionReceiptRepository receiptRepository;

    private String userId;

    @BeforeEach
    public void setupWallet() {
        userId = newUserId();
        createVerifiedWallet(userId, "Esi Owusu", "GHS", "500.00");
    }

    private static MomoPaymentRequest payment(String amount) {
        return new MomoPaymentRequest(new BigDecimal(amount), "GHS", "233241234567", null, null, newIdempotencyKey());
    }

    private MomoTransactionResponse perform(String path, MomoPaymentRequest request) throws Exception {
        MvcResult result = mockMvc.perform(postAs(userId, path).content(json(request)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), MomoTransactionResponse.class);
    }

    private ResultActions callback(String token, String referenceId, String status) throws Exception {
        ObjectNode body = objectMapper.createObjectNode();
        if (referenceId != null) {
            body.put("externalId", referenceId);
        }
        body.put("status", status);
        body.put("financialTransactionId", "FT-" + status);
        return mockMvc.perform(post("/momoWebhook")
                .param("token", token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(body)));
    }

    @Test
    @DisplayName("MOMO-001: Confirmed collection credits the wallet once")
    void requestToPay_ThenSuccessfulCallback_CreditsOnce() throws Exception {
        when(momoClient.requestToPay(any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));

        MomoTransactionResponse response = perform("/api/v1/momo/collections", payment("75"));
        assertThat(response.status()).isEqualTo(TransactionStatus.PENDING);
        assertThat(response.message()).isEqualTo("Please approve the payment on your phone");
        assertThat(balanceOf(userId)).isEqualByComparingTo("500");

        String referenceId = response.referenceId();
        when(momoClient.getStatus(MomoProduct.COLLECTION, referenceId))
                .thenReturn(gatewayResult(GatewayStatus.SUCCESS, "SUCCESSFUL", "FT-1001"));

        callback(MOMO_WEBHOOK_SECRET, referenceId, "SUCCESSFUL")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("processed"));
        callback(MOMO_WEBHOOK_SECRET, referenceId, "SUCCESSFUL")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("ignored"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("575");
        MomoTransaction transaction = momoTransactionRepository.findById(referenceId).orElseThrow();
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(transaction.getFinancialTransactionId()).isEqualTo("FT-1001");
        assertThat(transaction.getCallbackStatus()).isEqualTo("SUCCESSFUL");
        assertThat(receiptRepository.findByTransactionIdAndOwnerId(referenceId, userId)).isPresent();
    }

    @Test
    @DisplayName("MOMO-001: The provider status wins over the callback claim")
    void callback_ClaimsSuccessButProviderPending_DoesNotCredit() throws Exception {
        when(momoClient.requestToPay(any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));
        String referenceId = perform("/api/v1/momo/collections", payment("75")).referenceId();
        when(momoClient.getStatus(MomoProduct.COLLECTION, referenceId))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));

        callback(MOMO_WEBHOOK_SECRET, referenceId, "SUCCESSFUL")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("ignored"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("500");
        assertThat(momoTransactionRepository.findById(referenceId).orElseThrow().getStatus())
                .isEqualTo(TransactionStatus.PENDING);
    }

    @Test
    @DisplayName("MOMO-001: Status check applies the provider result")
    void checkStatus_ProviderSuccessful_CreditsWallet() throws Exception {
        when(momoClient.requestToPay(any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));
        String referenceId = perform("/api/v1/momo/collections", payment("40")).referenceId();
        when(momoClient.getStatus(MomoProduct.COLLECTION, referenceId))
                .thenReturn(gatewayResult(GatewayStatus.SUCCESS, "SUCCESSFUL", "FT-2002"));

        mockMvc.perform(getAs(userId, "/api/v1/momo/transactions/{referenceId}", referenceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.providerStatus").value("SUCCESSFUL"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("540");
    }

    @Test
    @DisplayName("MOMO-001: Rejected collection request")
    void requestToPay_ProviderRejects_ShouldReturn503() throws Exception {
        when(momoClient.requestToPay(any(), any(), any(), any(), any(), any()))
                .thenReturn(new GatewayResult("momo", GatewayStatus.FAILED, "400", null,
                        "{\"code\":\"PAYER_NOT_FOUND\"}", objectMapper.createObjectNode()));

        mockMvc.perform(postAs(userId, "/api/v1/momo/collections").content(json(payment("75"))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SERVICE_MOMO_ERROR"));

        assertThat(momoTransactionRepository.findAll()).singleElement().satisfies(transaction -> {
            assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(transaction.getFailureReason()).contains("PAYER_NOT_FOUND");
        });
        assertThat(balanceOf(userId)).isEqualByComparingTo("500");
    }

    @Test
    @DisplayName("MOMO-002: Rejected disbursement is refunded")
    void transfer_ProviderRejects_RefundsWallet() throws Exception {
        when(momoClient.transfer(any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.FAILED, "500", null));

        mockMvc.perform(postAs(userId, "/api/v1/momo/disbursements").content(json(payment("120"))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SERVICE_MOMO_ERROR"))
                .andExpect(jsonPath("$.details.refunded").value(true));

        assertThat(balanceOf(userId)).isEqualByComparingTo("500");
        assertThat(momoTransactionRepository.findAll()).singleElement().satisfies(transaction -> {
            assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(transaction.isRefunded()).isTrue();
        });
    }

    @Test
    @DisplayName("MOMO-002: Disbursement request that never reached the provider is refunded")
    void transfer_ProviderUnreachable_RefundsAndRetries() throws Exception {
        when(momoClient.transfer(any(), any(), any(), any(), any(), any()))
                .thenThrow(WalletException.service(ErrorCode.SERVICE_MOMO_ERROR,
                        new IllegalStateException("connect timed out"), Map.of("operation", "transfer")))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));
        when(momoClient.getStatus(eq(MomoProduct.DISBURSEMENT), any()))
                .thenReturn(gatewayResult(GatewayStatus.UNKNOWN, null, null));
        MomoPaymentRequest request = payment("120");

        mockMvc.perform(postAs(userId, "/api/v1/momo/disbursements").content(json(request)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SERVICE_MOMO_ERROR"))
                .andExpect(jsonPath("$.details.refunded").value(true));

        assertThat(balanceOf(userId)).isEqualByComparingTo("500");
        assertThat(momoTransactionRepository.findAll()).singleElement().satisfies(transaction -> {
            assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(transaction.isRefunded()).isTrue();
        });

        perform("/api/v1/momo/disbursements", request);

        assertThat(balanceOf(userId)).isEqualByComparingTo("380");
        assertThat(momoTransactionRepository.findAll())
                .extracting(MomoTransaction::getStatus)
                .containsExactlyInAnyOrder(TransactionStatus.FAILED, TransactionStatus.PENDING);
    }

    @Test
    @DisplayName("MOMO-002: Disbursement the provider holds after a failed request stays pending")
    void transfer_RequestFailsButProviderHoldsIt_KeepsDebit() throws Exception {
        when(momoClient.transfer(any(), any(), any(), any(), any(), any()))
                .thenThrow(WalletException.service(ErrorCode.SERVICE_MOMO_ERROR,
                        new IllegalStateException("read timed out"), Map.of("operation", "transfer")));
        when(momoClient.getStatus(eq(MomoProduct.DISBURSEMENT), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));

        MomoTransactionResponse response = perform("/api/v1/momo/disbursements", payment("120"));

        assertThat(response.status()).isEqualTo(TransactionStatus.PENDING);
        assertThat(balanceOf(userId)).isEqualByComparingTo("380");
        MomoTransaction transaction = momoTransactionRepository.findById(response.referenceId()).orElseThrow();
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(transaction.isRefunded()).isFalse();
    }

    @Test
    @DisplayName("MOMO-002: Failed disbursement callback refunds once")
    void transfer_ThenFailedCallback_RefundsOnce() throws Exception {
        when(momoClient.transfer(any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));

        MomoTransactionResponse response = perform("/api/v1/momo/disbursements", payment("120"));
        assertThat(response.message()).isEqualTo("Withdrawal is being processed");
        assertThat(balanceOf(userId)).isEqualByComparingTo("380");

        String referenceId = response.referenceId();
        when(momoClient.getStatus(MomoProduct.DISBURSEMENT, referenceId))
                .thenReturn(gatewayResult(GatewayStatus.FAILED, "FAILED", null));

        callback(MOMO_WEBHOOK_SECRET, referenceId, "FAILED")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("processed"));
        callback(MOMO_WEBHOOK_SECRET, referenceId, "FAILED")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("ignored"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("500");
        assertThat(receiptRepository.findByTransactionIdAndOwnerId(referenceId, userId).orElseThrow().getStatus())
                .isEqualTo(TransactionStatus.FAILED);
    }

    @Test
    @DisplayName("MOMO-002: Disbursement larger than the balance")
    void transfer_InsufficientBalance_ShouldReturn400() throws Exception {
        mockMvc.perform(postAs(userId, "/api/v1/momo/disbursements").content(json(payment("900"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("WALLET_INSUFFICIENT_FUNDS"));

        verify(momoClient, never()).transfer(any(), any(), any(), any(), any(), any());
        assertThat(momoTransactionRepository.count()).isZero();
    }

    @Test
    @DisplayName("MOMO-003: Wrong callback token")
    void callback_WrongToken_ShouldReturn403() throws Exception {
        callback("not-the-secret", "00000000-0000-0000-0000-000000000000", "SUCCESSFUL")
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.result").value("rejected"));
    }

    @Test
    @DisplayName("MOMO-003: Callback without externalId")
    void callback_MissingExternalId_ShouldReturn400() throws Exception {
        callback(MOMO_WEBHOOK_SECRET, null, "SUCCESSFUL")
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("MOMO-003: Callback for a reference this service never issued")
    void callback_UnknownReference_ShouldReturn404() throws Exception {
        callback(MOMO_WEBHOOK_SECRET, "00000000-0000-0000-0000-000000000000", "SUCCESSFUL")
                .andExpect(status().isNotFound());

        verify(momoClient, never()).getStatus(any(), any());
    }

    @Test
    @DisplayName("MOMO-003: Inconclusive provider status outside production trusts the callback")
    void callback_ProviderStatusUnknown_TrustsCallbackInSandbox() throws Exception {
        when(momoClient.requestToPay(any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));
        String referenceId = perform("/api/v1/momo/collections", payment("60")).referenceId();
        when(momoClient.getStatus(eq(MomoProduct.COLLECTION), eq(referenceId)))
                .thenReturn(gatewayResult(GatewayStatus.UNKNOWN, null, null));

        callback(MOMO_WEBHOOK_SECRET, referenceId, "SUCCESSFUL")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("processed"));

        assertThat(balanceOf(userId)).isEqualByComparingTo("560");
    }

    @Test
    @DisplayName("MOMO-004: Another user's transaction")
    void checkStatus_OtherUser_ShouldReturn403() throws Exception {
        when(momoClient.requestToPay(any(), any(), any(), any(), any(), any()))
                .thenReturn(gatewayResult(GatewayStatus.PENDING, "PENDING", null));
        String referenceId = perform("/api/v1/momo/collections", payment("40")).referenceId();
        String otherUser = newUserId();
        createVerifiedWallet(otherUser, "Kwame Nkrumah", "GHS", null);

        mockMvc.perform(getAs(otherUser, "/api/v1/momo/transactions/{referenceId}", referenceId))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("AUTH_PERMISSION_DENIED"));

        verify(momoClient, never()).getStatus(any(), any());
    }
}
