package com.qrwallet.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only record of a financial operation outcome. Never updated or deleted by the application.
 */
@Entity
@Immutable
@Table(name = "audit_logs")
@Getter
@Setter
@NoArgsConstructor
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private String userId;

    @Column(nullable = false, length = 64)
    private String operation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AuditResult result;

    @Column(precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(length = 3)
    private String currency;

    /**
     * JSON object with operation specific context (transaction id, reference, ...).
     */
    @Column(length = 4000)
    private String metadata;

    @Column(length = 1000)
    private String error;

    @Column(name = "ip_hash", length = 16)
    private String ipHash;

    @Column(name = "logged_at", nullable = false)
    private Instant timestamp;
}
