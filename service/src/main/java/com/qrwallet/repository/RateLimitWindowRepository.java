package com.qrwallet.repository;

import com.qrwallet.model.RateLimitWindow;
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
public interface RateLimitWindowRepository extends JpaRepository<RateLimitWindow, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RateLimitWindow r WHERE r.id = :id")
    Optional<RateLimitWindow> getOneForUpdate(@Param("id") String id);

    @Modifying
    @Query("DELETE FROM RateLimitWindow r WHERE r.updatedAt < :cutoff")
    int deleteIdleSince(@Param("cutoff") Instant cutoff);
}
