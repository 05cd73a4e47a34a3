package com.qrwallet.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mobile-money API product: collections pull money in, disbursements push money out.
 */
public enum MomoProduct {
    COLLECTION("collection"),
    DISBURSEMENT("disbursement");

    private final String value;

    MomoProduct(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MomoProduct fromValue(String value) {
        return "disbursement".equals(value) ? DISBURSEMENT : COLLECTION;
    }
}
