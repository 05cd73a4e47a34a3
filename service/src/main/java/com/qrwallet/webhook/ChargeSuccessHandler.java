package com.qrwallet.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.paystack.PaystackClient;
import com.qrwallet.gateway.paystack.RestPaystackClient;
import com.qrwallet.model.Payment;
import com.qrwallet.repository.PaymentRepository;
import com.qrwallet.service.DepositService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * {@code charge.success}: credits the payment's owner once, after confirming the charge with the gateway.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChargeSuccessHandler implements PaystackEventHandler {

    private final PaystackClient paystackClient;
    private final PaymentRepository paymentRepository;
    private final DepositService depositService;
    private final WebhookVerifier verifier;

    @Override
    public boolean supports(String event) {
        return "charge.success".equals(event);
    }

    @Override
    public WebhookOutcome handle(String event, JsonNode data) {
        String reference = data.path("reference").asText(null);
        if (reference == null) {
            return WebhookOutcome.rejected(400, "Missing reference");
        }
        Optional<Payment> payment = paymentRepository.findById(reference);
        if (payment.isEmpty()) {
            log.warn("Charge callback for unknown reference rejected: reference={}", reference);
            return WebhookOutcome.rejected(404, "Unknown reference");
        }
        if (payment.get().isProcessed()) {
            return WebhookOutcome.ignored("Already processed");
        }

        JsonNode charge;
        Optional<GatewayResult> verified = verifier.verify(reference, () -> paystackClient.verifyTransaction(reference));
        if (verified.isPresent()) {
            GatewayResult result = verified.get();
            verifier.logMismatch(reference, data.path("status").asText(null), result.providerStatus());
            if (result.isFailed()) {
                depositService.markPaymentFailed(reference, result.providerStatus());
                return WebhookOutcome.ignored("Charge not successful");
            }
            if (!result.isSuccess()) {
                return WebhookOutcome.ignored("Charge not settled");
            }
            charge = result.raw();
        } else if (verifier.mayTrustUnverified()) {
            log.warn("Applying unverified charge callback: reference={}", reference);
            charge = data;
        } else {
            return WebhookOutcome.rejected(502, "Verification failed");
        }

        BigDecimal amount = RestPaystackClient.fromMinorUnits(charge.path("amount").asLong());
        String currency = charge.path("currency").asText(payment.get().getCurrency());
        String channel = charge.path("channel").asText("card");

        DepositService.Confirmation confirmation = depositService.confirmPayment(reference,
                payment.get().getUserId(), amount, currency, channel, "Deposit via " + channel);
        return confirmation.credited()
                ? WebhookOutcome.processed("Wallet credited")
                : WebhookOutcome.ignored("Already processed");
    }
}
