package com.qrwallet.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's wallet.
 * <p>
 * Each user owns exactly one wallet. The public {@code walletId} ({@code QRW-XXXX-XXXX-XXXX}) is what other users
 * see and send money to; the numeric {@code id} never leaves the service.
 * </p>
 * <p>
 * Balances are mutated only while the row is locked for update inside a ledger transaction.
 * A debit never takes the balance below zero (also enforced by a CHECK constraint).
 * </p>
 */
@Entity
@Table(name = "wallets")
@Getter
@Setter
@NoArgsConstructor
public class Wallet {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, unique = true)
    private String ownerId;

    @Column(name = "wallet_id", nullable = false, unique = true, length = 18)
    private String walletId;

    /**
     * ISO 4217 code. All balances and spend counters of the wallet are in this currency.
     */
    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal balance = BigDecimal.ZERO;

    @Column(name = "daily_spent", nullable = false, precision = 19, scale = 2)
    private BigDecimal dailySpent = BigDecimal.ZERO;

    @Column(name = "monthly_spent", nullable = false, precision = 19, scale = 2)
    private BigDecimal monthlySpent = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WalletStatus status = WalletStatus.ACTIVE;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
