package com.qrwallet.service;

import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.model.StatefulRecord;
import com.qrwallet.model.StatusTransition;

import java.time.Instant;

/**
 * A validated, not yet applied status change.
 */
public record StateTransition(
        String recordType,
        String recordId,
        TransactionStatus from,
        TransactionStatus to,
        Instant at
) {

    /**
     * Stamps status, previousStatus and statusUpdatedAt on the record.
     */
    public void applyTo(StatefulRecord record) {
        record.setPreviousStatus(from);
        record.setStatus(to);
        record.setStatusUpdatedAt(at);
    }

    public StatusTransition toHistoryEntry() {
        return new StatusTransition(null, recordType, recordId, from, to, at);
    }
}
