package com.qrwallet.gateway;

/**
 * Gateway-neutral outcome of a call or of a status query.
 */
public enum GatewayStatus {
    SUCCESS,
    PENDING,
    OTP_REQUIRED,
    FAILED,
    /**
     * The gateway answered but the outcome could not be determined.
     */
    UNKNOWN
}
