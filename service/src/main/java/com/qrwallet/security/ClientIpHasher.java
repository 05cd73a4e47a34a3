package com.qrwallet.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Privacy-preserving client address fingerprint: first 16 hex chars of SHA-256 of the
 * {@code X-Forwarded-For} header, or of {@code unknown} when the header is absent.
 */
public final class ClientIpHasher {

    private ClientIpHasher() {
    }

    public static String hash(String forwardedFor) {
        String source = forwardedFor == null || forwardedFor.isBlank() ? "unknown" : forwardedFor;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(source.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
