package com.qrwallet.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a per-user transaction receipt.
 */
public enum ReceiptType {
    SEND("send"),
    RECEIVE("receive"),
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal");

    private final String value;

    ReceiptType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
