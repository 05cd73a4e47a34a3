package com.qrwallet.repository;

import com.qrwallet.model.AuditLogEntry;
import com.qrwallet.model.AuditResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntry, Long> {

    List<AuditLogEntry> findByUserIdAndOperationOrderByTimestampAsc(String userId, String operation);

    List<AuditLogEntry> findByOperationAndResult(String operation, AuditResult result);
}
