package com.qrwallet.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrwallet.api.model.MomoProduct;
import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.config.ExternalService;
import com.qrwallet.config.ServiceReadinessGate;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import com.qrwallet.gateway.momo.MomoClient;
import com.qrwallet.model.MomoTransaction;
import com.qrwallet.repository.MomoTransactionRepository;
import com.qrwallet.service.MomoService;
import com.qrwallet.service.TransactionStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Entry point for mobile-money provider callbacks.
 *
 * <p>Checks in order: shared token, body shape, that the reference id was issued by this service, then the
 * provider status endpoint. The verified status is applied through {@link MomoService#applyProviderStatus}.
 */
@Component
@Slf4j
public class MomoWebhookProcessor {

    private final WalletProperties properties;
    private final ServiceReadinessGate readinessGate;
    private final ObjectMapper objectMapper;
    private final MomoTransactionRepository momoTransactionRepository;
    private final MomoClient momoClient;
    private final MomoService momoService;
    private final TransactionStateMachine stateMachine;
    private final WebhookVerifier verifier;

    public MomoWebhookProcessor(WalletProperties properties,
                                ServiceReadinessGate readinessGate,
                                ObjectMapper objectMapper,
                                MomoTransactionRepository momoTransactionRepository,
                                MomoClient momoClient,
                                MomoService momoService,
                                TransactionStateMachine stateMachine,
                                WebhookVerifier verifier) {
        this.properties = properties;
        this.readinessGate = readinessGate;
        this.objectMapper = objectMapper;
        this.momoTransactionRepository = momoTransactionRepository;
        this.momoClient = momoClient;
        this.momoService = momoService;
        this.stateMachine = stateMachine;
        this.verifier = verifier;
    }

    public WebhookOutcome process(String token, byte[] rawBody) {
        WebhookOutcome tokenCheck = checkToken(token);
        if (tokenCheck != null) {
            return tokenCheck;
        }

        JsonNode body;
        try {
            body = rawBody == null || rawBody.length == 0 ? null : objectMapper.readTree(rawBody);
        } catch (IOException e) {
            log.warn("Unreadable mobile money callback body: {}", e.getMessage());
            body = null;
        }
        if (body == null || !body.hasNonNull("externalId") || !body.hasNonNull("status")) {
            return WebhookOutcome.rejected(400, "Missing externalId or status");
        }

        String referenceId = body.get("externalId").asText();
        String callbackStatus = body.get("status").asText();
        JsonNode callback = body;
        log.info("MoMo webhook received: referenceId={}, status={}", referenceId, callbackStatus);

        return WebhookOutcomes.guard("momo", () -> apply(referenceId, callbackStatus, callback));
    }

    private WebhookOutcome apply(String referenceId, String callbackStatus, JsonNode callback) {
        Optional<MomoTransaction> transaction = momoTransactionRepository.findById(referenceId);
        if (transaction.isEmpty()) {
            log.warn("MoMo callback for unknown reference rejected: referenceId={}", referenceId);
            return WebhookOutcome.rejected(404, "Unknown reference");
        }
        MomoProduct product = transaction.get().getType();

        Optional<GatewayResult> verified = readinessGate.isReady(product == MomoProduct.COLLECTION
                ? ExternalService.MOMO_COLLECTIONS
                : ExternalService.MOMO_DISBURSEMENTS)
                ? verifier.verify(referenceId, () -> momoClient.getStatus(product, referenceId))
                : Optional.empty();

        MomoService.Applied applied;
        String reason = callback.hasNonNull("reason") ? callback.get("reason").toString() : null;
        if (verified.isPresent()) {
            GatewayResult result = verified.get();
            verifier.logMismatch(referenceId, callbackStatus, result.providerStatus());
            String financialTransactionId = result.providerReference() != null
                    ? result.providerReference()
                    : callback.path("financialTransactionId").asText(null);
            applied = momoService.applyProviderStatus(referenceId, result.status(), result.providerStatus(),
                    financialTransactionId, callbackStatus, result.message() != null ? result.message() : reason);
        } else if (verifier.mayTrustUnverified()) {
            log.warn("Applying unverified MoMo callback: referenceId={}, status={}", referenceId, callbackStatus);
            applied = momoService.applyProviderStatus(referenceId, claimedStatus(callbackStatus), callbackStatus,
                    callback.path("financialTransactionId").asText(null), callbackStatus, reason);
        } else {
            return WebhookOutcome.rejected(502, "Verification failed");
        }

        return applied.changed()
                ? WebhookOutcome.processed("Transaction " + applied.transaction().getStatus().value())
                : WebhookOutcome.ignored("No change");
    }

    private WebhookOutcome checkToken(String token) {
        if (!readinessGate.isReady(ExternalService.MOMO_WEBHOOK)) {
            if (properties.isProduction()) {
                log.error("MoMo webhook refused: webhook secret not configured");
                return WebhookOutcome.rejected(503, "Webhook not configured");
            }
            return null;
        }
        byte[] expected = properties.getMomo().getWebhookSecret().getBytes(StandardCharsets.UTF_8);
        byte[] actual = token == null ? new byte[0] : token.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, actual)) {
            log.warn("MoMo webhook rejected: invalid token");
            return WebhookOutcome.rejected(403, "Invalid token");
        }
        return null;
    }

    private GatewayStatus claimedStatus(String callbackStatus) {
        TransactionStatus status = stateMachine.normalize(callbackStatus).orElse(TransactionStatus.PENDING);
        return switch (status) {
            case COMPLETED -> GatewayStatus.SUCCESS;
            case FAILED -> GatewayStatus.FAILED;
            default -> GatewayStatus.PENDING;
        };
    }
}
