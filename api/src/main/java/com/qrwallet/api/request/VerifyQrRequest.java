package com.qrwallet.api.request;

import jakarta.validation.constraints.NotBlank;

public record VerifyQrRequest(
        @NotBlank(message = "Missing payload or signature.")
        String payload,

        @NotBlank(message = "Missing payload or signature.")
        String signature
) {
}
