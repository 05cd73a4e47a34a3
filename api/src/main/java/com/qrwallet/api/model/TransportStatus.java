package com.qrwallet.api.model;

/**
 * Transport-level status class of an application error.
 *
 * <p>Every {@link ErrorCode} maps to exactly one transport status, which in turn
 * maps to the HTTP status returned to the caller.
 */
public enum TransportStatus {
    INVALID_ARGUMENT(400),
    FAILED_PRECONDITION(400),
    UNAUTHENTICATED(401),
    PERMISSION_DENIED(403),
    NOT_FOUND(404),
    ALREADY_EXISTS(409),
    RESOURCE_EXHAUSTED(429),
    INTERNAL(500),
    UNAVAILABLE(503);

    private final int httpStatus;

    TransportStatus(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Wire name, e.g. {@code failed-precondition}.
     */
    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }
}
