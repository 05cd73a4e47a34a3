package com.qrwallet.api.request;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

/**
 * Request for a mobile-money collection (request-to-pay) or disbursement (transfer).
 *
 * @param amount         Amount in {@code currency}
 * @param currency       Transaction currency, wallet currency when omitted
 * @param phoneNumber    MSISDN of the payer (collection) or payee (disbursement)
 * @param payerMessage   Message shown to the payer
 * @param payeeNote      Note shown to the payee
 * @param idempotencyKey Client-generated key, at least 16 characters
 */
public record MomoPaymentRequest(
        BigDecimal amount,
        String currency,
        @NotBlank(message = "Phone number is required")
        String phoneNumber,
        String payerMessage,
        String payeeNote,
        String idempotencyKey
) {
}
