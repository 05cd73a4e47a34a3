package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qrwallet.api.model.TransactionStatus;

/**
 * Response for withdrawal initiation.
 *
 * @param reference        Withdrawal reference ({@code WD_...})
 * @param status           Status of the withdrawal record
 * @param requiresOtp      {@code true} if the payout must be finalized with an OTP
 * @param transferCode     Gateway transfer code to pass to finalize (OTP flow only)
 * @param message          Human-readable outcome
 * @param idempotentReplay {@code true} when served from the idempotency cache
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WithdrawalResponse(
        String reference,
        TransactionStatus status,
        boolean requiresOtp,
        String transferCode,
        String message,
        Boolean idempotentReplay
) {
}
