package com.qrwallet.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Wallet top-up through the card gateway, keyed by the gateway reference.
 *
 * <p>Created unprocessed when the charge is initiated by this service; {@code processed} flips once, in the same
 * transaction that credits the wallet, so replays of the success notification are no-ops.
 */
@Entity
@Table(name = "payments")
@Getter
@Setter
@NoArgsConstructor
public class Payment {

    @Id
    @Column(length = 64)
    private String reference;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "wallet_id")
    private String walletId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    /**
     * Amount credited in the wallet's currency.
     */
    @Column(name = "credited_amount", precision = 19, scale = 2)
    private BigDecimal creditedAmount;

    private String channel;

    @Column(name = "gateway_status", length = 32)
    private String gatewayStatus;

    @Column(nullable = false)
    private boolean processed;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;
}
