package com.qrwallet.model;

public enum IdempotencyStatus {
    PENDING,
    COMPLETED,
    FAILED
}
