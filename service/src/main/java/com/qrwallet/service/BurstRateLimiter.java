package com.qrwallet.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Process-local limiter for unauthenticated-looking traffic patterns, keyed by hashed client address.
 *
 * <p>Two limits per client: a request budget per window and a budget of failed wallet lookups, after which
 * the client is cooled down until the failure budget refills. Buckets live in bounded caches that evict idle
 * clients, so memory stays capped regardless of the number of distinct addresses.
 */
@Component
@Slf4j
public class BurstRateLimiter {

    private final WalletProperties.Burst config;
    private final Cache<String, Bucket> requestBuckets;
    private final Cache<String, Bucket> failedLookupBuckets;

    public BurstRateLimiter(WalletProperties properties) {
        this.config = properties.getBurst();
        this.requestBuckets = Caffeine.newBuilder()
                .maximumSize(config.getMaxTrackedClients())
                .expireAfterAccess(config.getWindow())
                .build();
        this.failedLookupBuckets = Caffeine.newBuilder()
                .maximumSize(config.getMaxTrackedClients())
                .expireAfterAccess(config.getFailedLookupWindow())
                .build();
    }

    /**
     * Consumes one request from the client's budget.
     *
     * @throws WalletException RATE_LIMIT_EXCEEDED when the budget for the current window is spent
     */
    public void checkRequest(String clientKey) {
        Bucket bucket = requestBuckets.get(clientKey,
                key -> newBucket(config.getRequestsPerWindow(), config.getWindow()));
        if (!bucket.tryConsume(1)) {
            log.warn("Burst limit exceeded: client={}", clientKey);
            throw WalletException.of(ErrorCode.RATE_LIMIT_EXCEEDED, "Too many requests from this location.");
        }
    }

    /**
     * @throws WalletException RATE_COOLDOWN_ACTIVE once the client has used up its failed-lookup budget
     */
    public void checkCooldown(String clientKey) {
        Bucket bucket = failedLookupBuckets.getIfPresent(clientKey);
        if (bucket != null && bucket.getAvailableTokens() <= 0) {
            log.warn("Failed lookup cooldown active: client={}", clientKey);
            throw WalletException.of(ErrorCode.RATE_COOLDOWN_ACTIVE, "Too many failed attempts. Please wait 5 minutes.");
        }
    }

    public void recordFailedLookup(String clientKey) {
        Bucket bucket = failedLookupBuckets.get(clientKey,
                key -> newBucket(config.getFailedLookupLimit(), config.getFailedLookupWindow()));
        bucket.tryConsume(1);
    }

    private static Bucket newBucket(long capacity, Duration window) {
        return Bucket.builder()
                .addLimit(Bandwidth.classic(capacity, Refill.intervally(capacity, window)))
                .build();
    }
}
