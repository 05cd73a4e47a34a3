package com.qrwallet.repository;

import com.qrwallet.model.PlatformWallet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;

@Repository
public interface PlatformWalletRepository extends JpaRepository<PlatformWallet, String> {

    /**
     * In-place increment; concurrent transfers never overwrite each other's contribution.
     */
    @Modifying
    @Query("""
            UPDATE PlatformWallet p
            SET p.totalBalanceUsd = p.totalBalanceUsd + :usdAmount,
                p.totalTransactions = p.totalTransactions + 1,
                p.totalFeesCollected = p.totalFeesCollected + 1,
                p.updatedAt = :now
            WHERE p.id = :id
            """)
    int addFee(@Param("id") String id, @Param("usdAmount") BigDecimal usdAmount, @Param("now") Instant now);
}
