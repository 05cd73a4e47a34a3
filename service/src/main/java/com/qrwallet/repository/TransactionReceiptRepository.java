package com.qrwallet.repository;

import com.qrwallet.model.TransactionReceipt;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TransactionReceiptRepository extends JpaRepository<TransactionReceipt, Long> {

    /**
     * Newest receipts of one user.
     */
    List<TransactionReceipt> findByOwnerIdOrderByCreatedAtDesc(String ownerId, Pageable pageable);

    List<TransactionReceipt> findByTransactionId(String transactionId);

    Optional<TransactionReceipt> findByTransactionIdAndOwnerId(String transactionId, String ownerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM TransactionReceipt r WHERE r.transactionId = :transactionId AND r.ownerId = :ownerId")
    Optional<TransactionReceipt> getOneForUpdate(@Param("transactionId") String transactionId,
                                                 @Param("ownerId") String ownerId);
}
