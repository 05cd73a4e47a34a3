package com.qrwallet.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Fee collected on one transfer.
 */
@Entity
@Immutable
@Table(name = "platform_fee_records")
@Getter
@Setter
@NoArgsConstructor
public class PlatformFeeRecord {

    @Id
    @Column(name = "transaction_id", length = 64)
    private String transactionId;

    /**
     * Fee in {@code currency}.
     */
    @Column(name = "original_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal originalAmount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "usd_amount", nullable = false, precision = 24, scale = 6)
    private BigDecimal usdAmount;

    /**
     * Units of {@code currency} per USD used for {@code usdAmount}.
     */
    @Column(name = "exchange_rate", nullable = false, precision = 24, scale = 10)
    private BigDecimal exchangeRate;

    @Column(name = "sender_uid", nullable = false)
    private String senderUid;

    @Column(name = "sender_name")
    private String senderName;

    @Column(name = "transfer_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal transferAmount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
