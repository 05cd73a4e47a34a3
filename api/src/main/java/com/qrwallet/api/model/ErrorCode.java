package com.qrwallet.api.model;

/**
 * Machine-readable error codes returned by the wallet backend.
 *
 * <p>Codes are namespaced by concern (AUTH, KYC, WALLET, TXN, RATE, SERVICE, CONFIG, SYSTEM).
 * Each code carries its transport status and a default message that is safe to show to end users.
 */
public enum ErrorCode {
    // Authentication & authorization
    AUTH_UNAUTHENTICATED(TransportStatus.UNAUTHENTICATED, "Please sign in to continue."),
    AUTH_PERMISSION_DENIED(TransportStatus.PERMISSION_DENIED, "You do not have permission to perform this action."),
    AUTH_SESSION_EXPIRED(TransportStatus.UNAUTHENTICATED, "Your session has expired. Please sign in again."),

    // KYC
    KYC_REQUIRED(TransportStatus.FAILED_PRECONDITION, "Please complete identity verification to continue."),
    KYC_INCOMPLETE(TransportStatus.FAILED_PRECONDITION, "Your verification is incomplete. Please finish all steps."),
    KYC_VERIFICATION_FAILED(TransportStatus.FAILED_PRECONDITION, "Identity verification failed. Please try again."),

    // Wallet
    WALLET_NOT_FOUND(TransportStatus.NOT_FOUND, "Wallet not found. Please contact support."),
    WALLET_INSUFFICIENT_FUNDS(TransportStatus.FAILED_PRECONDITION, "Insufficient balance for this transaction."),
    WALLET_LIMIT_EXCEEDED(TransportStatus.FAILED_PRECONDITION, "Transaction exceeds your daily limit."),
    WALLET_SUSPENDED(TransportStatus.FAILED_PRECONDITION, "This wallet is suspended. Please contact support."),

    // Transactions
    TXN_INVALID_STATE(TransportStatus.FAILED_PRECONDITION, "This transaction cannot be modified."),
    TXN_DUPLICATE_REQUEST(TransportStatus.ALREADY_EXISTS, "This request has already been processed."),
    TXN_SELF_TRANSFER(TransportStatus.INVALID_ARGUMENT, "You cannot transfer to your own wallet."),
    TXN_RECIPIENT_NOT_FOUND(TransportStatus.NOT_FOUND, "Recipient wallet not found. Please check the ID."),
    TXN_NOT_FOUND(TransportStatus.NOT_FOUND, "Transaction not found."),
    TXN_AMOUNT_INVALID(TransportStatus.INVALID_ARGUMENT, "Please enter a valid amount."),
    TXN_AMOUNT_TOO_SMALL(TransportStatus.INVALID_ARGUMENT, "Amount is below the minimum allowed."),
    TXN_AMOUNT_TOO_LARGE(TransportStatus.INVALID_ARGUMENT, "Amount exceeds the maximum allowed."),

    // Rate limiting
    RATE_LIMIT_EXCEEDED(TransportStatus.RESOURCE_EXHAUSTED, "Too many requests. Please wait before trying again."),
    RATE_COOLDOWN_ACTIVE(TransportStatus.RESOURCE_EXHAUSTED, "Please wait before retrying this action."),

    // External services
    SERVICE_PAYSTACK_ERROR(TransportStatus.UNAVAILABLE, "Payment service error. Please try again."),
    SERVICE_MOMO_ERROR(TransportStatus.UNAVAILABLE, "MoMo service error. Please try again."),
    SERVICE_UNAVAILABLE(TransportStatus.UNAVAILABLE, "Service temporarily unavailable. Please try again."),

    // Configuration
    CONFIG_MISSING(TransportStatus.FAILED_PRECONDITION, "Service is not configured. Contact support."),
    CONFIG_INVALID(TransportStatus.FAILED_PRECONDITION, "Service configuration error. Contact support."),

    // System
    SYSTEM_INTERNAL_ERROR(TransportStatus.INTERNAL, "Something went wrong. Please try again later."),
    SYSTEM_VALIDATION_FAILED(TransportStatus.INVALID_ARGUMENT, "Invalid data provided.");

    private final TransportStatus transportStatus;
    private final String defaultMessage;

    ErrorCode(TransportStatus transportStatus, String defaultMessage) {
        this.transportStatus = transportStatus;
        this.defaultMessage = defaultMessage;
    }

    public TransportStatus transportStatus() {
        return transportStatus;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /**
     * External service errors are transient from the caller's point of view.
     */
    public boolean isRetryable() {
        return name().startsWith("SERVICE_");
    }
}
