package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Result of a peer-to-peer transfer.
 *
 * @param transactionId    Shared ID of the sender and recipient receipts
 * @param amount           Transferred amount in the sender's currency
 * @param fee              Fee charged to the sender
 * @param currency         Sender's currency
 * @param recipientName    Display name of the recipient
 * @param newBalance       Sender balance after the debit
 * @param idempotentReplay {@code true} when the response was served from the idempotency cache
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendMoneyResponse(
        String transactionId,
        BigDecimal amount,
        BigDecimal fee,
        String currency,
        String recipientName,
        BigDecimal newBalance,
        Boolean idempotentReplay
) {
}
