package com.qrwallet.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalised gateway response.
 *
 * @param gateway           Gateway name, for logs
 * @param status            Normalised outcome
 * @param providerStatus    Status string exactly as the gateway reported it, may be null
 * @param providerReference Identifier assigned by the gateway (recipient code, transfer code, ...), may be null
 * @param message           Gateway message, may be null
 * @param raw               The {@code data} part of the response body, never null
 */
public record GatewayResult(
        String gateway,
        GatewayStatus status,
        String providerStatus,
        String providerReference,
        String message,
        JsonNode raw
) {
    public boolean isSuccess() {
        return status == GatewayStatus.SUCCESS;
    }

    public boolean isFailed() {
        return status == GatewayStatus.FAILED;
    }
}
