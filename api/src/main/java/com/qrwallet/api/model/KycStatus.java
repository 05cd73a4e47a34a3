package com.qrwallet.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity verification status of a user. An unset status is represented by {@code null}.
 */
public enum KycStatus {
    PENDING("pending"),
    VERIFIED("verified"),
    REJECTED("rejected");

    private final String value;

    KycStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses the wire value, returning {@code null} for anything that is not a known status.
     */
    @JsonCreator
    public static KycStatus fromValue(String value) {
        for (KycStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        return null;
    }
}
