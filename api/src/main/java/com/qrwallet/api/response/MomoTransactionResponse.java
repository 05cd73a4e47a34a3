package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qrwallet.api.model.MomoProduct;
import com.qrwallet.api.model.TransactionStatus;

import java.math.BigDecimal;

/**
 * Mobile-money collection or disbursement record as seen by its owner.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MomoTransactionResponse(
        String referenceId,
        MomoProduct type,
        TransactionStatus status,
        BigDecimal amount,
        String currency,
        String providerStatus,
        String message,
        Boolean idempotentReplay
) {
}
