package com.qrwallet.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.model.IdempotencyKey;
import com.qrwallet.model.IdempotencyStatus;
import com.qrwallet.repository.IdempotencyKeyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Guarantees at-most-once execution of a money-moving operation per client-supplied key.
 *
 * <p>Three phases:
 * <ol>
 *   <li>Claim: in one short transaction, lock the key row and decide. A completed key replays the stored result,
 *       a failed key is reset to pending for a retry, a pending key is rejected as a duplicate in flight, and an
 *       absent (or expired) key is claimed as pending for the caller.</li>
 *   <li>Execute the operation, outside of any transaction held by this service.</li>
 *   <li>Mark the key completed with the serialized result, or failed with the error message.</li>
 * </ol>
 *
 * <p>Keys belong to the user who first claimed them; presenting another user's key is a permission error.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String REPLAY_FIELD = "idempotentReplay";
    private static final int COMPLETION_ATTEMPTS = 2;

    private final IdempotencyKeyRepository idempotencyKeyRepository;
    private final WalletProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    public IdempotencyService(IdempotencyKeyRepository idempotencyKeyRepository,
                              WalletProperties properties,
                              ObjectMapper objectMapper,
                              Clock clock,
                              PlatformTransactionManager transactionManager) {
        this.idempotencyKeyRepository = idempotencyKeyRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Runs {@code action} at most once for {@code key}.
     *
     * @param key        Client-supplied idempotency key (at least the configured minimum length)
     * @param operation  Operation name, stored for diagnostics
     * @param userId     Caller
     * @param resultType Type the cached result is deserialized into on replay
     * @param action     The operation itself
     * @return The fresh result, or the cached one with {@code idempotentReplay=true}
     * @throws WalletException SYSTEM_VALIDATION_FAILED for a missing/short key, AUTH_PERMISSION_DENIED for another
     *                         user's key, TXN_DUPLICATE_REQUEST while the same key is still in flight
     */
    public <T> T withIdempotency(String key, String operation, String userId, Class<T> resultType, Supplier<T> action) {
        int minLength = properties.getIdempotency().getMinKeyLength();
        if (key == null || key.length() < minLength) {
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED,
                    "Idempotency key required (min " + minLength + " characters).");
        }

        Claim claim = claim(key, operation, userId);
        if (claim.cachedResult() != null) {
            log.info("Idempotent replay: key={}, operation={}, userId={}", key, operation, userId);
            return replay(claim.cachedResult(), resultType);
        }

        T result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            markFailed(key, e);
            throw e;
        }

        markCompleted(key, result);
        return result;
    }

    /**
     * Deletes expired keys, at most one batch per call.
     *
     * @return Number of deleted keys
     */
    public int deleteExpiredKeys() {
        Instant now = Instant.now(clock);
        int batchSize = properties.getIdempotency().getCleanupBatchSize();
        Integer deleted = requiresNew.execute(status -> {
            List<String> expired = idempotencyKeyRepository.findExpiredKeys(now, PageRequest.of(0, batchSize));
            if (expired.isEmpty()) {
                return 0;
            }
            return idempotencyKeyRepository.deleteByKeys(expired);
        });
        return deleted == null ? 0 : deleted;
    }

    private Claim claim(String key, String operation, String userId) {
        try {
            return requiresNew.execute(status -> {
                Instant now = Instant.now(clock);
                IdempotencyKey existing = idempotencyKeyRepository.getOneForUpdate(key).orElse(null);

                if (existing != null && !existing.getUserId().equals(userId)) {
                    throw WalletException.of(ErrorCode.AUTH_PERMISSION_DENIED,
                            "Idempotency key belongs to another user.");
                }

                if (existing == null || existing.getExpiresAt().isBefore(now)) {
                    IdempotencyKey fresh = existing != null ? existing : new IdempotencyKey();
                    fresh.setKey(key);
                    fresh.setUserId(userId);
                    fresh.setOperation(operation);
                    fresh.setStatus(IdempotencyStatus.PENDING);
                    fresh.setResult(null);
                    fresh.setError(null);
                    fresh.setCreatedAt(now);
                    fresh.setExpiresAt(now.plus(properties.getIdempotency().getTtl()));
                    fresh.setRetryAt(null);
                    fresh.setCompletedAt(null);
                    fresh.setFailedAt(null);
                    idempotencyKeyRepository.saveAndFlush(fresh);
                    return Claim.fresh();
                }

                switch (existing.getStatus()) {
                    case COMPLETED:
                        return new Claim(existing.getResult());
                    case FAILED:
                        log.info("Retrying failed idempotent operation: key={}, operation={}, previousError={}",
                                key, operation, existing.getError());
                        existing.setStatus(IdempotencyStatus.PENDING);
                        existing.setRetryAt(now);
                        return Claim.fresh();
                    default:
                        throw WalletException.of(ErrorCode.TXN_DUPLICATE_REQUEST,
                                "Operation already in progress with this idempotency key.",
                                Map.of("operation", operation));
                }
            });
        } catch (DataIntegrityViolationException e) {
            // lost the insert race against a concurrent claim of the same key
            throw WalletException.of(ErrorCode.TXN_DUPLICATE_REQUEST,
                    "Operation already in progress with this idempotency key.",
                    Map.of("operation", operation));
        }
    }

    /**
     * Stores the result under the key. The write is attempted twice; a key left pending after that blocks retries
     * with a duplicate-request error until it expires, so the final failure is logged with the key.
     */
    private void markCompleted(String key, Object result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("Idempotency key left pending, result not serializable: key={}", key, e);
            return;
        }
        for (int attempt = 1; attempt <= COMPLETION_ATTEMPTS; attempt++) {
            try {
                requiresNew.executeWithoutResult(status -> idempotencyKeyRepository.getOneForUpdate(key)
                        .ifPresent(row -> {
                            row.setStatus(IdempotencyStatus.COMPLETED);
                            row.setResult(json);
                            row.setCompletedAt(Instant.now(clock));
                        }));
                return;
            } catch (RuntimeException e) {
                if (attempt < COMPLETION_ATTEMPTS) {
                    log.warn("Failed to mark idempotency key completed, retrying: key={}, error={}",
                            key, e.getMessage());
                } else {
                    log.error("Idempotency key left pending after {} attempts: key={}", COMPLETION_ATTEMPTS, key, e);
                }
            }
        }
    }

    private void markFailed(String key, RuntimeException cause) {
        try {
            requiresNew.executeWithoutResult(status -> idempotencyKeyRepository.getOneForUpdate(key).ifPresent(row -> {
                row.setStatus(IdempotencyStatus.FAILED);
                row.setError(truncate(cause.getMessage()));
                row.setFailedAt(Instant.now(clock));
            }));
        } catch (RuntimeException e) {
            log.error("Failed to mark idempotency key failed: key={}, originalError={}", key, cause.getMessage(), e);
        }
    }

    private <T> T replay(String cachedResult, Class<T> resultType) {
        try {
            JsonNode node = objectMapper.readTree(cachedResult);
            if (node instanceof ObjectNode objectNode) {
                objectNode.put(REPLAY_FIELD, true);
            }
            return objectMapper.treeToValue(node, resultType);
        } catch (JsonProcessingException e) {
            throw new WalletException(ErrorCode.SYSTEM_INTERNAL_ERROR, null, null, e);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000);
    }

    private record Claim(String cachedResult) {
        static Claim fresh() {
            return new Claim(null);
        }
    }
}
