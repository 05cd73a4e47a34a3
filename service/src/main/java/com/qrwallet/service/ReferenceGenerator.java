package com.qrwallet.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

/**
 * Identifiers for transfers, payouts and gateway charges.
 */
@Component
@RequiredArgsConstructor
public class ReferenceGenerator {

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final String WALLET_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    /**
     * {@code TXN<epochMillis><9 random chars>}, shared by both receipts of a transfer.
     */
    public String transferId() {
        return "TXN" + clock.millis() + randomBase36(9).toUpperCase(Locale.ROOT);
    }

    /**
     * {@code TXN-<epochMillis>}, the human-facing reference printed on transfer receipts.
     */
    public String receiptReference() {
        return "TXN-" + clock.millis();
    }

    public String withdrawalReference() {
        return "WD_" + clock.millis() + "_" + randomBase36(9);
    }

    public String mobileMoneyChargeReference() {
        return "MOMO_" + clock.millis() + "_" + randomBase36(9);
    }

    public String cardPaymentReference() {
        return "TXN_" + clock.millis() + "_" + randomBase36(9);
    }

    public String momoReferenceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Public wallet id {@code QRW-XXXX-XXXX-XXXX} drawn from an alphabet without look-alike characters.
     */
    public String walletId() {
        StringBuilder id = new StringBuilder("QRW");
        for (int group = 0; group < 3; group++) {
            id.append('-');
            for (int i = 0; i < 4; i++) {
                id.append(WALLET_ALPHABET.charAt(random.nextInt(WALLET_ALPHABET.length())));
            }
        }
        return id.toString();
    }

    private String randomBase36(int length) {
        StringBuilder value = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            value.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return value.toString();
    }
}
