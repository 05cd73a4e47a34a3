package com.qrwallet.repository;

import com.qrwallet.model.PlatformFeeRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlatformFeeRecordRepository extends JpaRepository<PlatformFeeRecord, String> {
}
