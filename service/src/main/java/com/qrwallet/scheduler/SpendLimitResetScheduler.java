package com.qrwallet.scheduler;

import com.qrwallet.service.SpendCounterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Resets wallet spend counters: daily at midnight UTC and monthly on the first day of the month.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.spend-reset.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SpendLimitResetScheduler {

    private final SpendCounterService spendCounterService;

    @Scheduled(cron = "${scheduler.spend-reset.daily-cron:0 0 0 * * *}", zone = "UTC")
    public void resetDaily() {
        try {
            int wallets = spendCounterService.resetDailySpent();
            log.info("Daily spend reset: wallets={}", wallets);
        } catch (Exception e) {
            log.error("Failed to reset daily spend: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${scheduler.spend-reset.monthly-cron:0 5 0 1 * *}", zone = "UTC")
    public void resetMonthly() {
        try {
            int wallets = spendCounterService.resetMonthlySpent();
            log.info("Monthly spend reset: wallets={}", wallets);
        } catch (Exception e) {
            log.error("Failed to reset monthly spend: {}", e.getMessage(), e);
        }
    }
}
