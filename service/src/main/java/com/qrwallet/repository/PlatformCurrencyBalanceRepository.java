package com.qrwallet.repository;

import com.qrwallet.model.PlatformCurrencyBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;

@Repository
public interface PlatformCurrencyBalanceRepository extends JpaRepository<PlatformCurrencyBalance, String> {

    @Modifying
    @Query("""
            UPDATE PlatformCurrencyBalance b
            SET b.amount = b.amount + :amount,
                b.usdEquivalent = b.usdEquivalent + :usdAmount,
                b.txCount = b.txCount + 1,
                b.lastTransactionAt = :now,
                b.updatedAt = :now
            WHERE b.currency = :currency
            """)
    int addFee(@Param("currency") String currency,
               @Param("amount") BigDecimal amount,
               @Param("usdAmount") BigDecimal usdAmount,
               @Param("now") Instant now);
}
