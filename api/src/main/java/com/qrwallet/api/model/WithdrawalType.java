package com.qrwallet.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Payout destination of a withdrawal.
 */
public enum WithdrawalType {
    BANK("bank"),
    MOBILE_MONEY("mobile_money");

    private final String value;

    WithdrawalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WithdrawalType fromValue(String value) {
        if (value == null) {
            return BANK;
        }
        for (WithdrawalType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown withdrawal type: " + value);
    }
}
