package com.qrwallet.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrwallet.model.AuditLogEntry;
import com.qrwallet.model.AuditResult;
import com.qrwallet.repository.AuditLogRepository;
import com.qrwallet.security.CallerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit trail of financial operations.
 *
 * <p>Writes run in their own transaction and never fail the calling operation: a write error is logged and dropped.
 * The hashed client address of the current request, if any, is recorded with every entry.
 */
@Service
@Slf4j
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final CallerContext callerContext;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    public AuditLogService(AuditLogRepository auditLogRepository, ObjectMapper objectMapper,
                           CallerContext callerContext, Clock clock,
                           PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.callerContext = callerContext;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void success(String userId, String operation, BigDecimal amount, String currency,
                        Map<String, ?> metadata) {
        write(userId, operation, AuditResult.SUCCESS, amount, currency, metadata, null);
    }

    public void failure(String userId, String operation, BigDecimal amount, String currency,
                        Map<String, ?> metadata, String error) {
        write(userId, operation, AuditResult.FAILURE, amount, currency, metadata, error);
    }

    private void write(String userId, String operation, AuditResult result, BigDecimal amount, String currency,
                       Map<String, ?> metadata, String error) {
        try {
            AuditLogEntry entry = new AuditLogEntry();
            entry.setUserId(userId);
            entry.setOperation(operation);
            entry.setResult(result);
            entry.setAmount(amount);
            entry.setCurrency(currency);
            entry.setMetadata(metadata == null || metadata.isEmpty() ? null : objectMapper.writeValueAsString(metadata));
            entry.setError(truncate(error, 1000));
            entry.setIpHash(callerContext.ipHash());
            entry.setTimestamp(Instant.now(clock));
            requiresNew.executeWithoutResult(status -> auditLogRepository.save(entry));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Audit log write failed: operation={}, userId={}, result={}", operation, userId, result, e);
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
