package com.qrwallet.api.response;

public record InitializeTransactionResponse(
        String reference,
        String authorizationUrl,
        String accessCode
) {
}
