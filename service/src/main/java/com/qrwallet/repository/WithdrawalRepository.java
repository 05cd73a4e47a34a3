package com.qrwallet.repository;

import com.qrwallet.model.Withdrawal;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WithdrawalRepository extends JpaRepository<Withdrawal, String> {

    Optional<Withdrawal> findByTransferCodeAndUserId(String transferCode, String userId);

    /**
     * Retrieves the withdrawal and locks it for update, serializing webhook deliveries and user actions
     * on the same payout.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Withdrawal w WHERE w.reference = :reference")
    Optional<Withdrawal> getOneForUpdate(@Param("reference") String reference);
}
