package com.qrwallet.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrwallet.gateway.paystack.PaystackSignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Entry point for card-gateway callbacks: checks the signature over the raw body, then dispatches on the event
 * type. Events no handler supports are acknowledged and ignored.
 */
@Component
@Slf4j
public class PaystackWebhookProcessor {

    private final PaystackSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final List<PaystackEventHandler> handlers;

    public PaystackWebhookProcessor(PaystackSignatureVerifier signatureVerifier, ObjectMapper objectMapper,
                                    List<PaystackEventHandler> handlers) {
        this.signatureVerifier = signatureVerifier;
        this.objectMapper = objectMapper;
        this.handlers = handlers;
    }

    public WebhookOutcome process(byte[] rawBody, String signature) {
        if (!signatureVerifier.isValid(rawBody, signature)) {
            log.warn("Gateway webhook rejected: invalid signature");
            return WebhookOutcome.rejected(401, "Invalid signature");
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            return WebhookOutcome.rejected(400, "Malformed body");
        }
        if (body == null || !body.hasNonNull("event")) {
            return WebhookOutcome.rejected(400, "Malformed body");
        }

        String event = body.get("event").asText();
        JsonNode data = body.path("data");
        log.info("Gateway webhook received: event={}, reference={}", event, data.path("reference").asText(null));

        return handlers.stream()
                .filter(handler -> handler.supports(event))
                .findFirst()
                .map(handler -> WebhookOutcomes.guard(event, () -> handler.handle(event, data)))
                .orElseGet(() -> WebhookOutcome.ignored("Unhandled event"));
    }
}
