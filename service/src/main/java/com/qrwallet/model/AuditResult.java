package com.qrwallet.model;

public enum AuditResult {
    SUCCESS,
    FAILURE
}
