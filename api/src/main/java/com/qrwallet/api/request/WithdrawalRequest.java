package com.qrwallet.api.request;

import com.qrwallet.api.model.WithdrawalType;
import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

/**
 * Request for withdrawing funds from the caller's wallet to a bank account or mobile-money number.
 *
 * @param amount              Amount in the wallet currency
 * @param type                Payout destination, {@code bank} when omitted
 * @param bankCode            Bank code (bank payouts)
 * @param accountNumber       Bank account number (bank payouts)
 * @param accountName         Name on the destination account
 * @param mobileMoneyProvider Provider code (mobile-money payouts)
 * @param phoneNumber         Phone number (mobile-money payouts)
 * @param idempotencyKey      Client-generated key, at least 16 characters
 */
public record WithdrawalRequest(
        BigDecimal amount,
        WithdrawalType type,
        String bankCode,
        String accountNumber,
        @NotBlank(message = "Account name is required")
        String accountName,
        String mobileMoneyProvider,
        String phoneNumber,
        String idempotencyKey
) {
}
