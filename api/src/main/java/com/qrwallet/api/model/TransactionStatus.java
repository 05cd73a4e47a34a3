package com.qrwallet.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status shared by withdrawals, mobile-money transactions and transaction receipts.
 *
 * <p>Terminal states: {@link #REFUNDED}, {@link #CANCELLED}. A {@link #COMPLETED} record may only
 * move to {@link #REFUNDED}.
 */
public enum TransactionStatus {
    CREATED("created"),
    PENDING("pending"),
    PENDING_OTP("pending_otp"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    REFUNDED("refunded"),
    CANCELLED("cancelled");

    private final String value;

    TransactionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TransactionStatus fromValue(String value) {
        for (TransactionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown transaction status: " + value);
    }
}
