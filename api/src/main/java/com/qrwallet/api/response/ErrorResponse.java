package com.qrwallet.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned for every failed request.
 *
 * @param code      Machine-readable error code, e.g. {@code WALLET_INSUFFICIENT_FUNDS}
 * @param status    Transport status, e.g. {@code failed-precondition}
 * @param message   Message safe to display to the user
 * @param details   Structured context (ids, limits); never contains secrets
 * @param timestamp When the error was produced
 * @param path      Request path
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        String code,
        String status,
        String message,
        Map<String, Object> details,
        Instant timestamp,
        String path
) {
    public static ErrorResponse of(String code, String status, String message, Map<String, Object> details, String path) {
        return new ErrorResponse(code, status, message, details, Instant.now(), path);
    }
}
