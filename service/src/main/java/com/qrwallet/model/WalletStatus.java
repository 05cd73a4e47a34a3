package com.qrwallet.model;

public enum WalletStatus {
    ACTIVE,
    SUSPENDED
}
