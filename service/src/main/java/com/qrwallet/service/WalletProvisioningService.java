package com.qrwallet.service;

import com.qrwallet.config.WalletProperties;
import com.qrwallet.model.UserAccount;
import com.qrwallet.model.Wallet;
import com.qrwallet.model.WalletStatus;
import com.qrwallet.repository.UserAccountRepository;
import com.qrwallet.repository.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Creates the user record and its wallet together, as the signup flow does.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletProvisioningService {

    private static final int MAX_ID_ATTEMPTS = 5;

    private final WalletRepository walletRepository;
    private final UserAccountRepository userAccountRepository;
    private final ReferenceGenerator referenceGenerator;
    private final WalletProperties properties;
    private final Clock clock;

    /**
     * @param currency Wallet currency; the configured default when blank
     * @return The new wallet with a zero balance
     */
    @Transactional
    public Wallet provision(String userId, String fullName, String email, String currency) {
        Instant now = Instant.now(clock);

        UserAccount user = new UserAccount();
        user.setId(userId);
        user.setFullName(fullName);
        user.setEmail(email);
        user.setCreatedAt(now);
        userAccountRepository.save(user);

        Wallet wallet = new Wallet();
        wallet.setOwnerId(userId);
        wallet.setWalletId(uniqueWalletId());
        wallet.setCurrency(StringUtils.hasText(currency) ? currency : properties.getWallet().getDefaultCurrency());
        wallet.setBalance(BigDecimal.ZERO);
        wallet.setStatus(WalletStatus.ACTIVE);
        wallet.setCreatedAt(now);
        wallet.setUpdatedAt(now);
        walletRepository.save(wallet);

        log.info("Wallet provisioned: userId={}, walletId={}, currency={}", userId, wallet.getWalletId(),
                wallet.getCurrency());
        return wallet;
    }

    private String uniqueWalletId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = referenceGenerator.walletId();
            if (!walletRepository.existsByWalletId(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique wallet ID");
    }
}
