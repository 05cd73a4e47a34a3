package com.qrwallet.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregate of transfer fees collected by the platform, in USD equivalent.
 * Counters are only changed with in-place increments.
 */
@Entity
@Table(name = "platform_wallet")
@Getter
@Setter
@NoArgsConstructor
public class PlatformWallet {

    @Id
    private String id;

    @Column(name = "total_balance_usd", nullable = false, precision = 24, scale = 6)
    private BigDecimal totalBalanceUsd;

    @Column(name = "total_transactions", nullable = false)
    private long totalTransactions;

    @Column(name = "total_fees_collected", nullable = false)
    private long totalFeesCollected;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
