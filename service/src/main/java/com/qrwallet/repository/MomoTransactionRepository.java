package com.qrwallet.repository;

import com.qrwallet.model.MomoTransaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MomoTransactionRepository extends JpaRepository<MomoTransaction, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM MomoTransaction m WHERE m.referenceId = :referenceId")
    Optional<MomoTransaction> getOneForUpdate(@Param("referenceId") String referenceId);
}
