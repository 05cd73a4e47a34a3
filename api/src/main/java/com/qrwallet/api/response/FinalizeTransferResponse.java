package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qrwallet.api.model.TransactionStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FinalizeTransferResponse(
        String reference,
        TransactionStatus status,
        Boolean idempotentReplay
) {
}
