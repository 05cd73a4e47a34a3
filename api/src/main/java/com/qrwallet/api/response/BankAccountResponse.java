package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BankAccountResponse(
        boolean success,
        String accountName,
        String accountNumber,
        Long bankId,
        String error
) {
}
