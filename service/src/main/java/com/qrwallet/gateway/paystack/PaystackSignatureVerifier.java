package com.qrwallet.gateway.paystack;

import com.qrwallet.config.WalletProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the HMAC-SHA512 signature the card gateway puts on webhook deliveries.
 *
 * <p>The signature is computed over the raw request body with the gateway secret key.
 */
@Component
@Slf4j
public class PaystackSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA512";

    private final WalletProperties properties;

    public PaystackSignatureVerifier(WalletProperties properties) {
        this.properties = properties;
    }

    public boolean isValid(byte[] rawBody, String signature) {
        String secret = properties.getPaystack().getSecretKey();
        if (!StringUtils.hasText(secret) || !StringUtils.hasText(signature) || rawBody == null) {
            return false;
        }
        byte[] expected = sign(rawBody, secret).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    static String sign(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA512 not available", e);
        }
    }
}
