package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QrVerificationResponse(
        boolean valid,
        String reason,
        String walletId,
        BigDecimal amount,
        String note,
        String recipientName,
        String profilePhotoUrl
) {
    public static QrVerificationResponse invalid(String reason) {
        return new QrVerificationResponse(false, reason, null, null, null, null, null);
    }
}
