package com.qrwallet.api.request;

import jakarta.validation.constraints.NotBlank;

public record VerifyPaymentRequest(
        @NotBlank(message = "Payment reference is required")
        String reference
) {
}
