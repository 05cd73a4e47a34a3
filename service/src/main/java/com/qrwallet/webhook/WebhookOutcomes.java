package com.qrwallet.webhook;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.error.WalletException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Maps failures raised while applying a callback to outcomes.
 */
@Slf4j
final class WebhookOutcomes {

    private WebhookOutcomes() {
    }

    /**
     * An invalid state transition means the callback is a replay or arrived out of order and is acknowledged.
     * An unknown record is refused. Anything else is retried by the gateway.
     */
    static WebhookOutcome guard(String event, Supplier<WebhookOutcome> handler) {
        try {
            return handler.get();
        } catch (WalletException e) {
            if (e.getCode() == ErrorCode.TXN_INVALID_STATE) {
                log.info("Webhook ignored, transition not allowed: event={}, details={}", event, e.getDetails());
                return WebhookOutcome.ignored("Transition not allowed");
            }
            if (e.getCode() == ErrorCode.TXN_NOT_FOUND) {
                return WebhookOutcome.rejected(404, "Unknown reference");
            }
            log.error("Webhook processing failed: event={}, errorCode={}, message={}", event, e.getCode(), e.getMessage());
            return WebhookOutcome.retry("Processing failed");
        } catch (RuntimeException e) {
            log.error("Webhook processing failed: event={}", event, e);
            return WebhookOutcome.retry("Processing failed");
        }
    }
}
