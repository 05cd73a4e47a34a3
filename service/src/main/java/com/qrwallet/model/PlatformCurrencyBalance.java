package com.qrwallet.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Fees collected in one currency, with their running USD equivalent at collection time.
 */
@Entity
@Table(name = "platform_currency_balances")
@Getter
@Setter
@NoArgsConstructor
public class PlatformCurrencyBalance {

    @Id
    @Column(length = 3)
    private String currency;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "usd_equivalent", nullable = false, precision = 24, scale = 6)
    private BigDecimal usdEquivalent;

    @Column(name = "tx_count", nullable = false)
    private long txCount;

    @Column(name = "last_transaction_at")
    private Instant lastTransactionAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
