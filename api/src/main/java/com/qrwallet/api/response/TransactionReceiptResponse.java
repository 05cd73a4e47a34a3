package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qrwallet.api.model.ReceiptType;
import com.qrwallet.api.model.TransactionStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One entry of the caller's transaction history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionReceiptResponse(
        String transactionId,
        ReceiptType type,
        TransactionStatus status,
        BigDecimal amount,
        BigDecimal fee,
        String currency,
        String senderWalletId,
        String receiverWalletId,
        String senderName,
        String receiverName,
        BigDecimal exchangeRate,
        BigDecimal convertedAmount,
        String receiverCurrency,
        String note,
        String reference,
        String description,
        Instant createdAt,
        Instant completedAt
) {
}
