package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param reference        Charge reference ({@code MOMO_...})
 * @param status           Gateway charge status ({@code success}, {@code send_otp}, {@code pay_offline}, ...)
 * @param completed        {@code true} if the wallet was credited immediately
 * @param message          Human-readable outcome
 * @param idempotentReplay {@code true} when served from the idempotency cache
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MobileMoneyChargeResponse(
        String reference,
        String status,
        boolean completed,
        String message,
        Boolean idempotentReplay
) {
}
