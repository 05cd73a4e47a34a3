package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Result of verifying a card-gateway payment.
 *
 * @param reference        Payment reference
 * @param success          {@code false} if the gateway does not report the charge as successful
 * @param alreadyProcessed {@code true} if the payment was credited earlier (webhook or previous verify)
 * @param amount           Credited amount in the charge currency
 * @param currency         Charge currency
 * @param newBalance       Wallet balance after the credit
 * @param message          Human-readable outcome
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentVerificationResponse(
        String reference,
        boolean success,
        boolean alreadyProcessed,
        BigDecimal amount,
        String currency,
        BigDecimal newBalance,
        String message
) {
}
