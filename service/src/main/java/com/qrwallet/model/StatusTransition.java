package com.qrwallet.model;

import com.qrwallet.api.model.TransactionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One accepted status change of a {@link StatefulRecord}. Rows are only ever inserted.
 */
@Entity
@Immutable
@Table(name = "status_transitions")
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class StatusTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_type", nullable = false, length = 32)
    private String recordType;

    @Column(name = "record_id", nullable = false)
    private String recordId;

    /**
     * Null for the entry recording creation.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 16)
    private TransactionStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 16)
    private TransactionStatus toStatus;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
