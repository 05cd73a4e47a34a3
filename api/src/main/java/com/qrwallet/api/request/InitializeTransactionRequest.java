package com.qrwallet.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

/**
 * Request for starting a hosted card payment that tops up the caller's wallet.
 *
 * @param email    Payer e-mail required by the card gateway
 * @param amount   Amount in major units
 * @param currency Charge currency, wallet currency when omitted
 */
public record InitializeTransactionRequest(
        @NotBlank(message = "Email is required")
        @Email(message = "Email must be valid")
        String email,
        BigDecimal amount,
        String currency
) {
}
