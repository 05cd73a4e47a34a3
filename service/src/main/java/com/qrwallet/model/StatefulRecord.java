package com.qrwallet.model;

import com.qrwallet.api.model.TransactionStatus;

import java.time.Instant;

/**
 * A financial record whose status is governed by the transaction state machine.
 */
public interface StatefulRecord {

    /**
     * Kind of record, used to key the status history (e.g. {@code withdrawal}).
     */
    String recordType();

    /**
     * Identifier of the record within its kind.
     */
    String recordId();

    TransactionStatus getStatus();

    void setStatus(TransactionStatus status);

    void setPreviousStatus(TransactionStatus previousStatus);

    void setStatusUpdatedAt(Instant statusUpdatedAt);
}
