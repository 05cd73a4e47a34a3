package com.qrwallet.webhook;

import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cross-verification of callbacks against the gateway status endpoints, and the policy for callbacks that
 * could not be verified.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookVerifier {

    private final WalletProperties properties;

    /**
     * Runs the gateway status query.
     *
     * @return The gateway's answer, or empty when the gateway could not be reached or gave no usable status
     */
    public Optional<GatewayResult> verify(String reference, Supplier<GatewayResult> statusQuery) {
        try {
            GatewayResult result = statusQuery.get();
            if (result.status() == GatewayStatus.UNKNOWN) {
                log.warn("Cross-verification inconclusive: reference={}, message={}", reference, result.message());
                return Optional.empty();
            }
            return Optional.of(result);
        } catch (WalletException e) {
            log.warn("Cross-verification failed: reference={}, errorCode={}", reference, e.getCode());
            return Optional.empty();
        }
    }

    /**
     * Whether a callback may be applied on its own claims when cross-verification failed. Never in production.
     */
    public boolean mayTrustUnverified() {
        return !properties.isProduction() && properties.getWebhooks().isTrustCallbackWhenUnverified();
    }

    public void logMismatch(String reference, String claimed, String verified) {
        if (claimed != null && !claimed.equalsIgnoreCase(verified)) {
            log.warn("Callback status mismatch, using gateway status: reference={}, claimed={}, verified={}",
                    reference, claimed, verified);
        }
    }
}
