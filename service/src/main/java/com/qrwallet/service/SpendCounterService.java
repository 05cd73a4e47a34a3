package com.qrwallet.service;

import com.qrwallet.repository.WalletRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodic resets of the per-wallet spend counters used by the daily limit.
 */
@Service
@RequiredArgsConstructor
public class SpendCounterService {

    private final WalletRepository walletRepository;
    private final Clock clock;

    @Transactional
    public int resetDailySpent() {
        return walletRepository.resetDailySpent(Instant.now(clock));
    }

    @Transactional
    public int resetMonthlySpent() {
        return walletRepository.resetMonthlySpent(Instant.now(clock));
    }
}
