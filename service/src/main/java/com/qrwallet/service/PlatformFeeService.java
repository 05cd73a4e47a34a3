package com.qrwallet.service;

import com.qrwallet.config.WalletProperties;
import com.qrwallet.model.PlatformCurrencyBalance;
import com.qrwallet.model.PlatformFeeRecord;
import com.qrwallet.repository.PlatformCurrencyBalanceRepository;
import com.qrwallet.repository.PlatformFeeRecordRepository;
import com.qrwallet.repository.PlatformWalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;

/**
 * Books transfer fees on the platform wallet: USD aggregate, per-currency balance and a per-transfer fee record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlatformFeeService {

    private final PlatformWalletRepository platformWalletRepository;
    private final PlatformCurrencyBalanceRepository currencyBalanceRepository;
    private final PlatformFeeRecordRepository feeRecordRepository;
    private final ExchangeRateService exchangeRateService;
    private final WalletProperties properties;
    private final Clock clock;

    /**
     * Creates the per-currency balance rows for every supported currency so fee booking only ever increments.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void ensureCurrencyBalances() {
        for (String currency : properties.getExchangeRates().getSupportedCurrencies()) {
            if (!currencyBalanceRepository.existsById(currency)) {
                currencyBalanceRepository.save(newBalance(currency));
            }
        }
    }

    /**
     * Books a collected fee. Must run inside the transfer's transaction so the fee is booked exactly when the
     * transfer commits.
     *
     * @param transactionId  Transfer id
     * @param fee            Fee in {@code currency}
     * @param currency       Sender currency
     * @param senderUid      Sender user id
     * @param senderName     Sender display name
     * @param transferAmount Transferred amount (excluding the fee)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordFee(String transactionId, BigDecimal fee, String currency, String senderUid, String senderName,
                          BigDecimal transferAmount) {
        Instant now = Instant.now(clock);
        BigDecimal rate = exchangeRateService.usdRateForAccounting(currency);
        BigDecimal usdAmount = fee.divide(rate, MathContext.DECIMAL64).setScale(6, RoundingMode.HALF_UP);

        int updated = platformWalletRepository.addFee(properties.getWallet().getPlatformWalletId(), usdAmount, now);
        if (updated == 0) {
            log.error("Platform wallet row missing, fee aggregate not updated: platformWalletId={}, transactionId={}",
                    properties.getWallet().getPlatformWalletId(), transactionId);
        }

        if (currencyBalanceRepository.addFee(currency, fee, usdAmount, now) == 0) {
            PlatformCurrencyBalance balance = newBalance(currency);
            balance.setAmount(fee);
            balance.setUsdEquivalent(usdAmount);
            balance.setTxCount(1);
            balance.setLastTransactionAt(now);
            balance.setUpdatedAt(now);
            currencyBalanceRepository.save(balance);
        }

        PlatformFeeRecord record = new PlatformFeeRecord();
        record.setTransactionId(transactionId);
        record.setOriginalAmount(fee);
        record.setCurrency(currency);
        record.setUsdAmount(usdAmount);
        record.setExchangeRate(rate);
        record.setSenderUid(senderUid);
        record.setSenderName(senderName);
        record.setTransferAmount(transferAmount);
        record.setCreatedAt(now);
        feeRecordRepository.save(record);

        log.debug("Fee booked: transactionId={}, fee={}, currency={}, usdAmount={}", transactionId, fee, currency, usdAmount);
    }

    private static PlatformCurrencyBalance newBalance(String currency) {
        PlatformCurrencyBalance balance = new PlatformCurrencyBalance();
        balance.setCurrency(currency);
        balance.setAmount(BigDecimal.ZERO);
        balance.setUsdEquivalent(BigDecimal.ZERO);
        balance.setTxCount(0);
        return balance;
    }
}
