package com.qrwallet.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.qrwallet.TestBase;
import com.qrwallet.api.model.KycStatus;
import com.qrwallet.api.model.ReceiptType;
import com.qrwallet.api.request.SendMoneyRequest;
import com.qrwallet.api.response.SendMoneyResponse;
import com.qrwallet.api.response.TransactionReceiptResponse;
import com.qrwallet.model.AuditResult;
import com.qrwallet.model.Wallet;
import com.qrwallet.repository.AuditLogRepository;
import com.qrwallet.repository.PlatformFeeRecordRepository;
import com.qrwallet.repository.TransactionReceiptRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for peer-to-peer transfers.
 *
 * <p>Tests verify:
 * <ul>
 *   <li>TRF-001: Amount plus fee is debited, amount is credited, one receipt per party</li>
 *   <li>TRF-002: Repeating a request with the same idempotency key moves money once</li>
 *   <li>TRF-003: Cross-currency transfers convert at the stored rates</li>
 *   <li>TRF-004: Rejected transfers leave both balances untouched</li>
 * </ul>
 */
@DisplayName("1. Transfer Tests")
public class TransferTest extends TestBase {

    @Autowired
    private TransactionReceiptRepository receiptRepository;

    @Autowired
    private PlatformFeeRecordRepository platformFeeRecordRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Test
    @DisplayName("TRF-001: Transfer between wallets in the same currency")
    void sendMoney_SameCurrency_DebitsAmountPlusFee() throws Exception {
        String senderId = newUserId();
        String recipientId = newUserId();
        createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");
        Wallet recipient = createVerifiedWallet(recipientId, "Kofi Boateng", "GHS", null);

        SendMoneyRequest request = new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("500"),
                "Lunch", newIdempotencyKey());

        MvcResult result = mockMvc.perform(postAs(senderId, "/api/v1/transfers").content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactionId").exists())
                .andExpect(jsonPath("$.currency").value("GHS"))
                .andExpect(jsonPath("$.recipientName").value("Kofi Boateng"))
                .andExpect(jsonPath("$.idempotentReplay").doesNotExist())
                .andReturn();

        SendMoneyResponse response = objectMapper.readValue(result.getResponse().getContentAsString(),
                SendMoneyResponse.class);
        assertThat(response.fee()).isEqualByComparingTo("10");
        assertThat(response.newBalance()).isEqualByComparingTo("490");

        assertThat(balanceOf(senderId)).isEqualByComparingTo("490");
        assertThat(balanceOf(recipientId)).isEqualByComparingTo("500");

        assertThat(receiptRepository.findByTransactionId(response.transactionId()))
                .extracting(receipt -> receipt.getOwnerId() + ":" + receipt.getType())
                .containsExactlyInAnyOrder(senderId + ":" + ReceiptType.SEND, recipientId + ":" + ReceiptType.RECEIVE);
        assertThat(platformFeeRecordRepository.findById(response.transactionId())).isPresent();
        assertThat(auditLogRepository.findByUserIdAndOperationOrderByTimestampAsc(senderId, "sendMoney"))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getResult()).isEqualTo(AuditResult.SUCCESS);
                    assertThat(entry.getAmount()).isEqualByComparingTo("500");
                    assertThat(entry.getMetadata()).contains(response.transactionId());
                });

        MvcResult history = mockMvc.perform(getAs(recipientId, "/api/v1/transactions"))
                .andExpect(status().isOk())
                .andReturn();
        List<TransactionReceiptResponse> receipts = objectMapper.readValue(
                history.getResponse().getContentAsString(), new TypeReference<>() {});
        assertThat(receipts).hasSize(1);
        assertThat(receipts.get(0).type()).isEqualTo(ReceiptType.RECEIVE);
        assertThat(receipts.get(0).senderName()).isEqualTo("Ama Mensah");
        assertThat(receipts.get(0).note()).isEqualTo("Lunch");
    }

    @Test
    @DisplayName("TRF-002: Replayed request returns the original result")
    void sendMoney_SameIdempotencyKey_MovesMoneyOnce() throws Exception {
        String senderId = newUserId();
        String recipientId = newUserId();
        createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");
        Wallet recipient = createVerifiedWallet(recipientId, "Kofi Boateng", "GHS", null);

        SendMoneyRequest request = new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("100"),
                null, newIdempotencyKey());

        MvcResult first = mockMvc.perform(postAs(senderId, "/api/v1/transfers").content(json(request)))
                .andExpect(status().isOk())
                .andReturn();
        String transactionId = objectMapper.readValue(first.getResponse().getContentAsString(),
                SendMoneyResponse.class).transactionId();

        mockMvc.perform(postAs(senderId, "/api/v1/transfers").content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactionId").value(transactionId))
                .andExpect(jsonPath("$.idempotentReplay").value(true));

        assertThat(balanceOf(senderId)).isEqualByComparingTo("890");
        assertThat(balanceOf(recipientId)).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("TRF-002: Another user's idempotency key is refused")
    void sendMoney_KeyOfAnotherUser_ShouldReturn403() throws Exception {
        String firstSender = newUserId();
        String secondSender = newUserId();
        String recipientId = newUserId();
        createVerifiedWallet(firstSender, "Ama Mensah", "GHS", "1000.00");
        createVerifiedWallet(secondSender, "Yaw Asante", "GHS", "1000.00");
        Wallet recipient = createVerifiedWallet(recipientId, "Kofi Boateng", "GHS", null);
        String key = newIdempotencyKey();

        mockMvc.perform(postAs(firstSender, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("100"), null, key))))
                .andExpect(status().isOk());

        mockMvc.perform(postAs(secondSender, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("100"), null, key))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("AUTH_PERMISSION_DENIED"));

        assertThat(balanceOf(secondSender)).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("TRF-002: A failed request can be retried with the same key")
    void sendMoney_RetryAfterFailure_ExecutesAgain() throws Exception {
        String senderId = newUserId();
        String recipientId = newUserId();
        Wallet sender = createVerifiedWallet(senderId, "Ama Mensah", "GHS", "50.00");
        Wallet recipient = createVerifiedWallet(recipientId, "Kofi Boateng", "GHS", null);
        SendMoneyRequest request = new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("100"),
                null, newIdempotencyKey());

        mockMvc.perform(postAs(senderId, "/api/v1/transfers").content(json(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("WALLET_INSUFFICIENT_FUNDS"));

        sender = walletRepository.findById(sender.getId()).orElseThrow();
        sender.setBalance(new BigDecimal("500.00"));
        walletRepository.save(sender);

        mockMvc.perform(postAs(senderId, "/api/v1/transfers").content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.idempotentReplay").doesNotExist());

        assertThat(balanceOf(senderId)).isEqualByComparingTo("390");
        assertThat(balanceOf(recipientId)).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("TRF-003: Cross-currency transfer converts the amount")
    void sendMoney_DifferentCurrencies_CreditsConvertedAmount() throws Exception {
        seedExchangeRate("GHS", "10");
        seedExchangeRate("NGN", "1500");
        String senderId = newUserId();
        String recipientId = newUserId();
        createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");
        Wallet recipient = createVerifiedWallet(recipientId, "Chidi Okafor", "NGN", null);

        mockMvc.perform(postAs(senderId, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("100"),
                                null, newIdempotencyKey()))))
                .andExpect(status().isOk());

        assertThat(balanceOf(senderId)).isEqualByComparingTo("890");
        assertThat(balanceOf(recipientId)).isEqualByComparingTo("15000");
    }

    @Test
    @DisplayName("TRF-003: Missing exchange rate refuses the transfer")
    void sendMoney_NoExchangeRate_ShouldReturn503() throws Exception {
        String senderId = newUserId();
        String recipientId = newUserId();
        createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");
        Wallet recipient = createVerifiedWallet(recipientId, "Chidi Okafor", "NGN", null);

        mockMvc.perform(postAs(senderId, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("100"),
                                null, newIdempotencyKey()))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SERVICE_UNAVAILABLE"));

        assertThat(balanceOf(senderId)).isEqualByComparingTo("1000");
        assertThat(balanceOf(recipientId)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("TRF-004: Transfer to own wallet is refused")
    void sendMoney_ToOwnWallet_ShouldReturn400() throws Exception {
        String senderId = newUserId();
        Wallet sender = createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");

        mockMvc.perform(postAs(senderId, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest(sender.getWalletId(), new BigDecimal("100"),
                                null, newIdempotencyKey()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TXN_SELF_TRANSFER"));

        assertThat(balanceOf(senderId)).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("TRF-004: Unknown recipient")
    void sendMoney_UnknownRecipient_ShouldReturn404() throws Exception {
        String senderId = newUserId();
        createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");

        mockMvc.perform(postAs(senderId, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest("QRW-AAAA-BBBB-CCCC", new BigDecimal("100"),
                                null, newIdempotencyKey()))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TXN_RECIPIENT_NOT_FOUND"));
    }

    @Test
    @DisplayName("TRF-004: Non-positive amount")
    void sendMoney_ZeroAmount_ShouldReturn400() throws Exception {
        String senderId = newUserId();
        String recipientId = newUserId();
        createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");
        Wallet recipient = createVerifiedWallet(recipientId, "Kofi Boateng", "GHS", null);

        mockMvc.perform(postAs(senderId, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest(recipient.getWalletId(), BigDecimal.ZERO,
                                null, newIdempotencyKey()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TXN_AMOUNT_INVALID"));
    }

    @Test
    @DisplayName("TRF-004: Short idempotency key")
    void sendMoney_ShortIdempotencyKey_ShouldReturn400() throws Exception {
        String senderId = newUserId();
        String recipientId = newUserId();
        createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");
        Wallet recipient = createVerifiedWallet(recipientId, "Kofi Boateng", "GHS", null);

        mockMvc.perform(postAs(senderId, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("100"),
                                null, "short"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SYSTEM_VALIDATION_FAILED"));

        assertThat(balanceOf(senderId)).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("TRF-004: Sender without verified identity")
    void sendMoney_KycPending_ShouldReturn400() throws Exception {
        String senderId = newUserId();
        String recipientId = newUserId();
        createVerifiedWallet(senderId, "Ama Mensah", "GHS", "1000.00");
        setKycStatus(senderId, KycStatus.PENDING);
        Wallet recipient = createVerifiedWallet(recipientId, "Kofi Boateng", "GHS", null);

        mockMvc.perform(postAs(senderId, "/api/v1/transfers")
                        .content(json(new SendMoneyRequest(recipient.getWalletId(), new BigDecimal("100"),
                                null, newIdempotencyKey()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("KYC_REQUIRED"))
                .andExpect(jsonPath("$.details.kycStatus").value("pending"));
    }

    @Test
    @DisplayName("TRF-004: Request without caller identity")
    void sendMoney_Unauthenticated_ShouldReturn401() throws Exception {
        mockMvc.perform(post("/api/v1/transfers")
                        .contentType("application/json")
                        .content("{\"recipientWalletId\":\"QRW-AAAA-BBBB-CCCC\",\"amount\":100}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_UNAUTHENTICATED"));
    }
}
