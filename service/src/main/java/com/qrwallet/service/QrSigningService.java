package com.qrwallet.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.request.SignQrRequest;
import com.qrwallet.api.request.VerifyQrRequest;
import com.qrwallet.api.response.QrVerificationResponse;
import com.qrwallet.api.response.SignedQrResponse;
import com.qrwallet.config.ExternalService;
import com.qrwallet.config.ServiceReadinessGate;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.model.UserAccount;
import com.qrwallet.model.Wallet;
import com.qrwallet.repository.UserAccountRepository;
import com.qrwallet.repository.WalletRepository;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Signs and verifies payment-request QR payloads.
 *
 * <p>The payload is a JSON document ({@code walletId}, optional {@code amount} and {@code note}, {@code issuedAt},
 * {@code expiresAt}) signed with HMAC-SHA256 under the QR secret. Verification compares signatures in constant time
 * and checks expiry and that the wallet still exists.
 */
@Service
@Validated
@Slf4j
public class QrSigningService {

    private static final String ALGORITHM = "HmacSHA256";

    private final ServiceReadinessGate readinessGate;
    private final WalletRepository walletRepository;
    private final UserAccountRepository userAccountRepository;
    private final ObjectMapper objectMapper;
    private final WalletProperties properties;
    private final Clock clock;

    public QrSigningService(ServiceReadinessGate readinessGate,
                            WalletRepository walletRepository,
                            UserAccountRepository userAccountRepository,
                            ObjectMapper objectMapper,
                            WalletProperties properties,
                            Clock clock) {
        this.readinessGate = readinessGate;
        this.walletRepository = walletRepository;
        this.userAccountRepository = userAccountRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws WalletException AUTH_PERMISSION_DENIED unless the caller owns the wallet
     */
    public SignedQrResponse sign(String userId, @Valid SignQrRequest request) {
        readinessGate.requireReady(ExternalService.QR);

        Wallet wallet = walletRepository.findByWalletId(request.walletId())
                .filter(candidate -> candidate.getOwnerId().equals(userId))
                .orElseThrow(() -> WalletException.of(ErrorCode.AUTH_PERMISSION_DENIED,
                        "You can only create QR codes for your own wallet."));
        if (request.amount() != null && request.amount().signum() <= 0) {
            throw WalletException.of(ErrorCode.TXN_AMOUNT_INVALID, "Amount must be positive.");
        }

        long issuedAt = clock.millis();
        long expiresAt = issuedAt + properties.getQr().getExpiry().toMillis();
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("walletId", wallet.getWalletId());
        if (request.amount() != null) {
            content.put("amount", request.amount());
        }
        if (request.note() != null && !request.note().isBlank()) {
            content.put("note", request.note());
        }
        content.put("issuedAt", issuedAt);
        content.put("expiresAt", expiresAt);

        String payload;
        try {
            payload = objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new WalletException(ErrorCode.SYSTEM_INTERNAL_ERROR, null, null, e);
        }
        log.debug("QR payload signed: walletId={}, expiresAt={}", wallet.getWalletId(), expiresAt);
        return new SignedQrResponse(payload, hmac(payload), expiresAt);
    }

    public QrVerificationResponse verify(@Valid VerifyQrRequest request) {
        readinessGate.requireReady(ExternalService.QR);

        byte[] expected = hmac(request.payload()).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = request.signature().trim().toLowerCase().getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            log.warn("QR signature mismatch");
            return QrVerificationResponse.invalid("Invalid signature");
        }

        JsonNode content;
        try {
            content = objectMapper.readTree(request.payload());
        } catch (JsonProcessingException e) {
            return QrVerificationResponse.invalid("Malformed payload");
        }
        String walletId = content.path("walletId").asText(null);
        if (walletId == null || !content.path("expiresAt").canConvertToLong()) {
            return QrVerificationResponse.invalid("Malformed payload");
        }
        if (content.path("expiresAt").asLong() < clock.millis()) {
            return QrVerificationResponse.invalid("QR code expired");
        }

        Optional<Wallet> wallet = walletRepository.findByWalletId(walletId);
        if (wallet.isEmpty()) {
            return QrVerificationResponse.invalid("Wallet not found");
        }
        Optional<UserAccount> owner = userAccountRepository.findById(wallet.get().getOwnerId());
        BigDecimal amount = content.hasNonNull("amount") ? content.get("amount").decimalValue() : null;
        return new QrVerificationResponse(true, null, walletId, amount,
                content.path("note").asText(null),
                owner.map(UserAccount::getFullName).orElse(WalletLookupService.DEFAULT_DISPLAY_NAME),
                owner.map(UserAccount::getProfilePhotoUrl).orElse(null));
    }

    private String hmac(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(properties.getQr().getSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }
}
