package com.qrwallet.repository;

import com.qrwallet.model.IdempotencyKey;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface IdempotencyKeyRepository extends JpaRepository<IdempotencyKey, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT k FROM IdempotencyKey k WHERE k.key = :key")
    Optional<IdempotencyKey> getOneForUpdate(@Param("key") String key);

    @Query("SELECT k.key FROM IdempotencyKey k WHERE k.expiresAt < :now ORDER BY k.expiresAt ASC")
    List<String> findExpiredKeys(@Param("now") Instant now, Pageable pageable);

    @Modifying
    @Query("DELETE FROM IdempotencyKey k WHERE k.key IN :keys")
    int deleteByKeys(@Param("keys") List<String> keys);
}
