package com.qrwallet.scheduler;

import com.qrwallet.service.ExchangeRateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily exchange-rate refresh at midnight UTC, plus one refresh at startup when no rates are stored yet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.exchange-rates.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ExchangeRateScheduler {

    private final ExchangeRateService exchangeRateService;

    @EventListener(ApplicationReadyEvent.class)
    public void refreshIfEmpty() {
        if (!exchangeRateService.hasRates()) {
            log.info("No exchange rates stored, refreshing at startup");
            refreshRates();
        }
    }

    @Scheduled(cron = "${scheduler.exchange-rates.cron:0 0 0 * * *}", zone = "UTC")
    public void refreshRates() {
        log.info("Starting scheduled job: refresh exchange rates");

        try {
            int stored = exchangeRateService.refreshRates();
            log.info("Stored {} exchange rates", stored);
        } catch (Exception e) {
            log.error("Failed to refresh exchange rates: {}", e.getMessage(), e);
        }
    }
}
