package com.qrwallet.api.request;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

/**
 * Request for topping up the wallet with a mobile-money charge through the card gateway.
 */
public record ChargeMobileMoneyRequest(
        @NotBlank(message = "Email is required")
        String email,
        BigDecimal amount,
        String currency,
        @NotBlank(message = "Provider is required")
        String provider,
        @NotBlank(message = "Phone number is required")
        String phoneNumber,
        String idempotencyKey
) {
}
