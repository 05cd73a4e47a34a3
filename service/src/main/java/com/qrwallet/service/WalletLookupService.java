package com.qrwallet.service;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.response.WalletLookupResponse;
import com.qrwallet.error.WalletException;
import com.qrwallet.model.UserAccount;
import com.qrwallet.model.Wallet;
import com.qrwallet.repository.UserAccountRepository;
import com.qrwallet.repository.WalletRepository;
import com.qrwallet.security.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves public wallet IDs to display information for payers.
 *
 * <p>Lookups pass the local burst limiter and failed-lookup cooldown (keyed by hashed client address) before the
 * persistent per-user limit. Misses are counted towards the cooldown to slow down wallet ID enumeration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletLookupService {

    static final String OPERATION = "lookupWallet";
    static final String DEFAULT_DISPLAY_NAME = "QR Wallet User";
    private static final Pattern WALLET_ID = Pattern.compile("^QRW-[A-Z0-9]{4}-[A-Z0-9]{4}-[A-Z0-9]{4}$");

    private final BurstRateLimiter burstRateLimiter;
    private final RateLimitService rateLimitService;
    private final CallerContext callerContext;
    private final WalletRepository walletRepository;
    private final UserAccountRepository userAccountRepository;

    public WalletLookupResponse lookupWallet(String userId, String walletId) {
        String clientKey = callerContext.ipHash();
        burstRateLimiter.checkRequest(clientKey);
        burstRateLimiter.checkCooldown(clientKey);
        rateLimitService.enforceRateLimit(userId, OPERATION);

        if (walletId == null || !WALLET_ID.matcher(walletId.trim().toUpperCase()).matches()) {
            burstRateLimiter.recordFailedLookup(clientKey);
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED, "Invalid wallet ID.");
        }

        Optional<Wallet> wallet = walletRepository.findByWalletId(walletId.trim().toUpperCase());
        if (wallet.isEmpty()) {
            burstRateLimiter.recordFailedLookup(clientKey);
            log.info("Wallet lookup miss: client={}", clientKey);
            return WalletLookupResponse.notFound();
        }

        Optional<UserAccount> owner = userAccountRepository.findById(wallet.get().getOwnerId());
        String name = owner.map(UserAccount::getFullName)
                .filter(fullName -> !fullName.isBlank())
                .orElse(DEFAULT_DISPLAY_NAME);
        String photo = owner.map(UserAccount::getProfilePhotoUrl).orElse(null);
        return new WalletLookupResponse(true, wallet.get().getWalletId(), name, photo);
    }
}
