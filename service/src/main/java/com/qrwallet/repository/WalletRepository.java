package com.qrwallet.repository;

import com.qrwallet.model.Wallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface WalletRepository extends JpaRepository<Wallet, Long> {

    Optional<Wallet> findByWalletId(String walletId);

    Optional<Wallet> findByOwnerId(String ownerId);

    boolean existsByWalletId(String walletId);

    /**
     * Retrieves the {@link Wallet} with the given primary key and locks it for update.
     * <p>
     * Uses a <b>pessimistic write lock</b>: concurrent debits of the same wallet serialize on the row, so the balance
     * read inside the surrounding transaction stays valid until commit. Keep the surrounding transaction short and
     * never perform network calls while holding the lock.
     * </p>
     * <p>
     * When two wallets must be locked, lock them in ascending {@code id} order.
     * </p>
     *
     * @param id Primary key of the wallet
     * @return The locked wallet, or empty if it does not exist
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.id = :id")
    Optional<Wallet> getOneForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.ownerId = :ownerId")
    Optional<Wallet> getByOwnerForUpdate(@Param("ownerId") String ownerId);

    @Modifying
    @Query("UPDATE Wallet w SET w.dailySpent = 0, w.updatedAt = :now WHERE w.dailySpent <> 0")
    int resetDailySpent(@Param("now") Instant now);

    @Modifying
    @Query("UPDATE Wallet w SET w.monthlySpent = 0, w.updatedAt = :now WHERE w.monthlySpent <> 0")
    int resetMonthlySpent(@Param("now") Instant now);
}
