package com.qrwallet.repository;

import com.qrwallet.model.StatusTransition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StatusTransitionRepository extends JpaRepository<StatusTransition, Long> {

    List<StatusTransition> findByRecordTypeAndRecordIdOrderByIdAsc(String recordType, String recordId);
}
