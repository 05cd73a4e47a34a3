package com.qrwallet.webhook;

/**
 * Result of handling one gateway callback, mapped to the HTTP status the gateway sees.
 *
 * <p>PROCESSED and IGNORED are acknowledged with 200 so the gateway stops redelivering. REJECTED carries the
 * status explaining why the callback was refused. RETRY answers 500 so the gateway delivers again later.
 */
public record WebhookOutcome(Result result, int httpStatus, String message) {

    public enum Result {
        PROCESSED,
        IGNORED,
        REJECTED,
        RETRY
    }

    public static WebhookOutcome processed(String message) {
        return new WebhookOutcome(Result.PROCESSED, 200, message);
    }

    public static WebhookOutcome ignored(String message) {
        return new WebhookOutcome(Result.IGNORED, 200, message);
    }

    public static WebhookOutcome rejected(int httpStatus, String message) {
        return new WebhookOutcome(Result.REJECTED, httpStatus, message);
    }

    public static WebhookOutcome retry(String message) {
        return new WebhookOutcome(Result.RETRY, 500, message);
    }
}
