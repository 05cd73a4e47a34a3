package com.qrwallet.controller;

import com.qrwallet.config.WalletProperties;
import com.qrwallet.webhook.MomoWebhookProcessor;
import com.qrwallet.webhook.PaystackWebhookProcessor;
import com.qrwallet.webhook.WebhookOutcome;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated gateway callbacks. Authenticity is checked by the processors (signature or shared token).
 * Other HTTP methods are answered with 405 by the exception handler.
 */
@RestController
@Tag(name = "Webhooks", description = "Payment gateway callbacks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final PaystackWebhookProcessor paystackWebhookProcessor;
    private final MomoWebhookProcessor momoWebhookProcessor;
    private final WalletProperties properties;

    @PostMapping("/gatewayWebhook")
    public ResponseEntity<Map<String, Object>> gatewayWebhook(@RequestBody(required = false) byte[] body,
                                                              HttpServletRequest request) {
        String signature = request.getHeader(properties.getPaystack().getSignatureHeader());
        return respond(paystackWebhookProcessor.process(body, signature));
    }

    @PostMapping("/momoWebhook")
    public ResponseEntity<Map<String, Object>> momoWebhook(@RequestParam(value = "token", required = false) String token,
                                                           @RequestBody(required = false) byte[] body) {
        return respond(momoWebhookProcessor.process(token, body));
    }

    private static ResponseEntity<Map<String, Object>> respond(WebhookOutcome outcome) {
        log.info("Webhook handled: result={}, httpStatus={}, message={}",
                outcome.result(), outcome.httpStatus(), outcome.message());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("result", outcome.result().name().toLowerCase());
        body.put("message", outcome.message());
        return ResponseEntity.status(outcome.httpStatus()).body(body);
    }
}
