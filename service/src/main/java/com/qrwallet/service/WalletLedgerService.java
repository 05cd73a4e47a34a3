package com.qrwallet.service;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.model.Wallet;
import com.qrwallet.model.WalletStatus;
import com.qrwallet.repository.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Balance mutations on user wallets.
 *
 * <p>Every method runs inside the caller's transaction and works on wallets locked for update, so a balance check
 * and the debit that depends on it can never interleave with another debit of the same wallet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletLedgerService {

    private final WalletRepository walletRepository;
    private final ExchangeRateService exchangeRateService;
    private final WalletProperties properties;
    private final Clock clock;

    /**
     * Amount applied to a wallet after currency conversion; {@code rate} is null when none was needed.
     */
    public record Posting(Wallet wallet, BigDecimal walletAmount, BigDecimal rate) {
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet lockByOwner(String ownerId) {
        return walletRepository.getByOwnerForUpdate(ownerId)
                .orElseThrow(() -> WalletException.of(ErrorCode.WALLET_NOT_FOUND));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet lockById(Long id) {
        return walletRepository.getOneForUpdate(id)
                .orElseThrow(() -> WalletException.of(ErrorCode.WALLET_NOT_FOUND));
    }

    /**
     * Debits a locked wallet.
     *
     * @param countTowardsLimits Whether the debit counts towards the daily and monthly spend counters
     * @throws WalletException WALLET_SUSPENDED, WALLET_INSUFFICIENT_FUNDS or WALLET_LIMIT_EXCEEDED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void debit(Wallet wallet, BigDecimal amount, boolean countTowardsLimits) {
        requireActive(wallet);

        if (wallet.getBalance().compareTo(amount) < 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("walletId", wallet.getWalletId());
            details.put("required", amount);
            details.put("available", wallet.getBalance());
            throw WalletException.of(ErrorCode.WALLET_INSUFFICIENT_FUNDS, null, details);
        }

        if (countTowardsLimits) {
            BigDecimal dailyLimit = properties.getTransfer().getDailyLimit();
            if (dailyLimit.signum() > 0 && wallet.getDailySpent().add(amount).compareTo(dailyLimit) > 0) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("walletId", wallet.getWalletId());
                details.put("dailyLimit", dailyLimit);
                details.put("dailySpent", wallet.getDailySpent());
                throw WalletException.of(ErrorCode.WALLET_LIMIT_EXCEEDED, null, details);
            }
            wallet.setDailySpent(wallet.getDailySpent().add(amount));
            wallet.setMonthlySpent(wallet.getMonthlySpent().add(amount));
        }

        wallet.setBalance(wallet.getBalance().subtract(amount));
        wallet.setUpdatedAt(Instant.now(clock));
        log.debug("Wallet debited: walletId={}, amount={}, balance={}", wallet.getWalletId(), amount, wallet.getBalance());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void credit(Wallet wallet, BigDecimal amount) {
        wallet.setBalance(wallet.getBalance().add(amount));
        wallet.setUpdatedAt(Instant.now(clock));
        log.debug("Wallet credited: walletId={}, amount={}, balance={}", wallet.getWalletId(), amount, wallet.getBalance());
    }

    /**
     * Locks the owner's wallet and credits {@code amount} given in {@code currency}, converted into the wallet's
     * currency when they differ.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Posting creditOwner(String ownerId, BigDecimal amount, String currency) {
        Wallet wallet = lockByOwner(ownerId);
        ExchangeRateService.Conversion conversion = exchangeRateService.convert(amount, currency, wallet.getCurrency());
        credit(wallet, conversion.amount());
        return new Posting(wallet, conversion.amount(), conversion.rate());
    }

    /**
     * Locks the owner's wallet and debits {@code amount} given in {@code currency}, converted into the wallet's
     * currency when they differ. Payouts do not count towards the spend counters.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Posting debitOwner(String ownerId, BigDecimal amount, String currency) {
        Wallet wallet = lockByOwner(ownerId);
        ExchangeRateService.Conversion conversion = exchangeRateService.convert(amount, currency, wallet.getCurrency());
        debit(wallet, conversion.amount(), false);
        return new Posting(wallet, conversion.amount(), conversion.rate());
    }

    /**
     * Credits back a previous payout debit, given in the wallet's currency.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet refundOwner(String ownerId, BigDecimal walletAmount) {
        Wallet wallet = lockByOwner(ownerId);
        credit(wallet, walletAmount);
        log.info("Wallet refunded: walletId={}, amount={}", wallet.getWalletId(), walletAmount);
        return wallet;
    }

    private static void requireActive(Wallet wallet) {
        if (wallet.getStatus() != WalletStatus.ACTIVE) {
            throw WalletException.of(ErrorCode.WALLET_SUSPENDED, null, Map.of("walletId", wallet.getWalletId()));
        }
    }

    /**
     * @throws WalletException WALLET_SUSPENDED if the wallet cannot take part in transfers
     */
    public void requireTransferable(Wallet wallet) {
        requireActive(wallet);
    }
}
