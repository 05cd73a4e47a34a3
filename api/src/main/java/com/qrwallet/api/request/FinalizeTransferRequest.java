package com.qrwallet.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Request for completing an OTP-gated withdrawal.
 */
public record FinalizeTransferRequest(
        @NotBlank(message = "Transfer code is required")
        String transferCode,

        @NotBlank(message = "OTP is required")
        String otp,

        String idempotencyKey
) {
}
