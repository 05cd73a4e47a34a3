package com.qrwallet.webhook;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handler for one or more card-gateway webhook event types.
 */
public interface PaystackEventHandler {

    boolean supports(String event);

    /**
     * @param event Event type, e.g. {@code charge.success}
     * @param data  The event's {@code data} object
     */
    WebhookOutcome handle(String event, JsonNode data);
}
