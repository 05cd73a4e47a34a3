package com.qrwallet.api.request;

import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request for a peer-to-peer transfer from the caller's wallet.
 *
 * <p>Amount and recipient are validated by the transfer service so that
 * violations surface with transaction error codes rather than generic validation errors.
 *
 * @param recipientWalletId Public wallet ID of the recipient ({@code QRW-XXXX-XXXX-XXXX})
 * @param amount            Amount in the sender's currency
 * @param note              Optional free-text note shown on both receipts
 * @param idempotencyKey    Client-generated key, at least 16 characters
 */
public record SendMoneyRequest(
        String recipientWalletId,
        BigDecimal amount,
        @Size(max = 280, message = "Note must be at most 280 characters")
        String note,
        String idempotencyKey
) {
}
