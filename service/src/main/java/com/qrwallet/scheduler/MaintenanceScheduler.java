package com.qrwallet.scheduler;

import com.qrwallet.service.IdempotencyService;
import com.qrwallet.service.RateLimitService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Garbage collection of ephemeral records: expired idempotency keys and idle rate-limit windows.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   maintenance:
 *     enabled: true
 *     idempotency-cron: "0 0 0/6 * * *"   # every 6 hours
 *     rate-limit-cron: "0 30 * * * *"     # every hour
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.maintenance.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class MaintenanceScheduler {

    private final IdempotencyService idempotencyService;
    private final RateLimitService rateLimitService;

    @Scheduled(cron = "${scheduler.maintenance.idempotency-cron:0 0 0/6 * * *}", zone = "UTC")
    public void deleteExpiredIdempotencyKeys() {
        log.info("Starting scheduled job: delete expired idempotency keys");

        try {
            int deleted = idempotencyService.deleteExpiredKeys();
            if (deleted > 0) {
                log.info("Deleted {} expired idempotency keys", deleted);
            } else {
                log.debug("No expired idempotency keys found");
            }
        } catch (Exception e) {
            log.error("Failed to delete expired idempotency keys: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${scheduler.maintenance.rate-limit-cron:0 30 * * * *}", zone = "UTC")
    public void deleteIdleRateLimitWindows() {
        log.info("Starting scheduled job: delete idle rate limit windows");

        try {
            int deleted = rateLimitService.deleteIdleWindows();
            log.info("Deleted {} idle rate limit windows", deleted);
        } catch (Exception e) {
            log.error("Failed to delete idle rate limit windows: {}", e.getMessage(), e);
        }
    }
}
