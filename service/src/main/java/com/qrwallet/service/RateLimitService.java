package com.qrwallet.service;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.model.RateLimitWindow;
import com.qrwallet.repository.RateLimitWindowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistent sliding-window rate limiter, keyed by (user, operation).
 *
 * <p>The window row is read, pruned and appended to under a row lock, so concurrent requests of one user count
 * exactly. Storage failures let the request through (logged); an exceeded limit never does.
 */
@Service
@Slf4j
public class RateLimitService {

    private final RateLimitWindowRepository rateLimitWindowRepository;
    private final WalletProperties properties;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    public RateLimitService(RateLimitWindowRepository rateLimitWindowRepository,
                            WalletProperties properties,
                            Clock clock,
                            PlatformTransactionManager transactionManager) {
        this.rateLimitWindowRepository = rateLimitWindowRepository;
        this.properties = properties;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Counts one request of {@code operation} for {@code userId}.
     *
     * @throws WalletException RATE_LIMIT_EXCEEDED with the operation's message when the window is full
     */
    public void enforceRateLimit(String userId, String operation) {
        WalletProperties.RateLimitRule rule = properties.getRateLimits().get(operation);
        if (rule == null) {
            log.warn("No rate limit configured: operation={}", operation);
            return;
        }

        try {
            try {
                requiresNew.executeWithoutResult(status -> checkAndRecord(userId, operation, rule));
            } catch (DataIntegrityViolationException e) {
                // two first requests raced to create the window row; the second attempt finds it
                requiresNew.executeWithoutResult(status -> checkAndRecord(userId, operation, rule));
            }
        } catch (DataAccessException | TransactionException e) {
            log.error("Rate limit check failed, allowing request: userId={}, operation={}", userId, operation, e);
        }
    }

    /**
     * Deletes windows that have not been touched for longer than the largest configured window.
     *
     * @return Number of deleted windows
     */
    public int deleteIdleWindows() {
        Duration longest = properties.getRateLimits().values().stream()
                .map(WalletProperties.RateLimitRule::getWindow)
                .max(Duration::compareTo)
                .orElse(Duration.ofHours(1));
        Instant cutoff = Instant.now(clock).minus(longest);
        Integer deleted = requiresNew.execute(status -> rateLimitWindowRepository.deleteIdleSince(cutoff));
        return deleted == null ? 0 : deleted;
    }

    private void checkAndRecord(String userId, String operation, WalletProperties.RateLimitRule rule) {
        Instant now = Instant.now(clock);
        long nowMillis = now.toEpochMilli();
        long windowStart = nowMillis - rule.getWindow().toMillis();
        String id = userId + "_" + operation;

        RateLimitWindow window = rateLimitWindowRepository.getOneForUpdate(id).orElse(null);
        boolean created = window == null;
        if (created) {
            window = new RateLimitWindow();
            window.setId(id);
            window.setUserId(userId);
            window.setOperation(operation);
        }

        List<Long> recent = new ArrayList<>();
        for (Long timestamp : window.getRequests()) {
            if (timestamp > windowStart) {
                recent.add(timestamp);
            }
        }

        if (recent.size() >= rule.getMaxRequests()) {
            long oldest = recent.stream().mapToLong(Long::longValue).min().orElse(nowMillis);
            long retryAfterSeconds = Math.max(1, (oldest + rule.getWindow().toMillis() - nowMillis + 999) / 1000);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("operation", operation);
            details.put("limit", rule.getMaxRequests());
            details.put("retryAfterSeconds", retryAfterSeconds);

            log.warn("Rate limit exceeded: userId={}, operation={}, count={}, limit={}",
                    userId, operation, recent.size(), rule.getMaxRequests());
            throw WalletException.of(ErrorCode.RATE_LIMIT_EXCEEDED, rule.getMessage(), details);
        }

        recent.add(nowMillis);
        window.setRequests(recent);
        window.setUpdatedAt(now);
        if (created) {
            rateLimitWindowRepository.saveAndFlush(window);
        }
    }
}
