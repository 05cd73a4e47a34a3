package com.qrwallet.api.response;

/**
 * @param payload   JSON payload that was signed, to be embedded in the QR code verbatim
 * @param signature Hex HMAC-SHA256 of {@code payload}
 * @param expiresAt Epoch milliseconds after which verification fails
 */
public record SignedQrResponse(String payload, String signature, long expiresAt) {
}
