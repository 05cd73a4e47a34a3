package com.qrwallet.api.request;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

/**
 * Request for signing a payment-request QR payload for one of the caller's wallets.
 */
public record SignQrRequest(
        @NotBlank(message = "Invalid wallet ID.")
        String walletId,
        BigDecimal amount,
        String note
) {
}
