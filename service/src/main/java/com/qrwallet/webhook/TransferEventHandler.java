package com.qrwallet.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import com.qrwallet.gateway.paystack.PaystackClient;
import com.qrwallet.repository.WithdrawalRepository;
import com.qrwallet.service.WithdrawalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * {@code transfer.success}, {@code transfer.failed} and {@code transfer.reversed}: settles a withdrawal with the
 * status the gateway reports for it, refunding the wallet when the payout failed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransferEventHandler implements PaystackEventHandler {

    private static final String SUCCESS = "transfer.success";

    private final PaystackClient paystackClient;
    private final WithdrawalRepository withdrawalRepository;
    private final WithdrawalService withdrawalService;
    private final WebhookVerifier verifier;

    @Override
    public boolean supports(String event) {
        return SUCCESS.equals(event) || "transfer.failed".equals(event) || "transfer.reversed".equals(event);
    }

    @Override
    public WebhookOutcome handle(String event, JsonNode data) {
        String reference = data.path("reference").asText(null);
        if (reference == null) {
            return WebhookOutcome.rejected(400, "Missing reference");
        }
        if (!withdrawalRepository.existsById(reference)) {
            log.warn("Transfer callback for unknown reference rejected: reference={}", reference);
            return WebhookOutcome.rejected(404, "Unknown reference");
        }

        GatewayStatus status;
        String reason = data.path("reason").asText(null);
        Optional<GatewayResult> verified = verifier.verify(reference, () -> paystackClient.verifyTransfer(reference));
        if (verified.isPresent()) {
            GatewayResult result = verified.get();
            verifier.logMismatch(reference, data.path("status").asText(null), result.providerStatus());
            status = result.status();
            if (result.raw().hasNonNull("reason")) {
                reason = result.raw().get("reason").asText();
            }
        } else if (verifier.mayTrustUnverified()) {
            log.warn("Applying unverified transfer callback: reference={}, event={}", reference, event);
            status = SUCCESS.equals(event) ? GatewayStatus.SUCCESS : GatewayStatus.FAILED;
        } else {
            return WebhookOutcome.rejected(502, "Verification failed");
        }

        return switch (status) {
            case SUCCESS -> withdrawalService.completeWithdrawal(reference)
                    ? WebhookOutcome.processed("Withdrawal completed")
                    : WebhookOutcome.ignored("Already completed");
            case FAILED -> withdrawalService.failWithdrawal(reference, reason)
                    ? WebhookOutcome.processed("Withdrawal failed and refunded")
                    : WebhookOutcome.ignored("Already failed");
            default -> WebhookOutcome.ignored("Transfer not final");
        };
    }
}
