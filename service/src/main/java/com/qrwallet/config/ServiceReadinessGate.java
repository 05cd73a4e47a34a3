package com.qrwallet.config;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.error.WalletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Startup validation of the secrets each external service needs, with a fast readiness query.
 *
 * <p>Missing secrets are computed once when the bean is created and logged as a single error line.
 * Operations touching an unconfigured service call {@link #requireReady(ExternalService)} first and
 * fail with {@code CONFIG_MISSING} before any state is touched or any network call is made.
 */
@Component
@Slf4j
public class ServiceReadinessGate {

    private final Map<ExternalService, List<String>> missingByService = new EnumMap<>(ExternalService.class);

    public ServiceReadinessGate(WalletProperties properties) {
        Map<ExternalService, Map<String, String>> required = requiredConfig(properties);

        TreeSet<String> allMissing = new TreeSet<>();
        required.forEach((service, keys) -> {
            List<String> missing = new ArrayList<>();
            keys.forEach((key, value) -> {
                if (!StringUtils.hasText(value)) {
                    missing.add(key);
                }
            });
            missingByService.put(service, Collections.unmodifiableList(missing));
            allMissing.addAll(missing);
        });

        if (allMissing.isEmpty()) {
            log.info("All critical service configuration present");
        } else {
            log.error("CRITICAL CONFIG MISSING ({}): {}. Operations depending on these keys will fail with CONFIG_MISSING",
                    allMissing.size(), String.join(", ", allMissing));
        }
    }

    public boolean isReady(ExternalService service) {
        return missingByService.getOrDefault(service, List.of()).isEmpty();
    }

    /**
     * Fails fast if any secret required by {@code service} is missing.
     *
     * @throws WalletException CONFIG_MISSING naming the service (never the secret values)
     */
    public void requireReady(ExternalService service) {
        List<String> missing = missingByService.getOrDefault(service, List.of());
        if (!missing.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("service", service.serviceName());
            details.put("missingKeys", missing);
            throw WalletException.of(ErrorCode.CONFIG_MISSING,
                    "Service unavailable: " + service.serviceName() + " is not configured. Contact support.",
                    details);
        }
    }

    public List<String> missingKeys(ExternalService service) {
        return missingByService.getOrDefault(service, List.of());
    }

    private static Map<ExternalService, Map<String, String>> requiredConfig(WalletProperties properties) {
        Map<ExternalService, Map<String, String>> required = new EnumMap<>(ExternalService.class);

        required.put(ExternalService.PAYSTACK, Map.of(
                "qrwallet.paystack.secret-key", nullToEmpty(properties.getPaystack().getSecretKey())));
        required.put(ExternalService.QR, Map.of(
                "qrwallet.qr.secret", nullToEmpty(properties.getQr().getSecret())));
        required.put(ExternalService.MOMO_COLLECTIONS, credentials("collections", properties.getMomo().getCollections()));
        required.put(ExternalService.MOMO_DISBURSEMENTS, credentials("disbursements", properties.getMomo().getDisbursements()));
        required.put(ExternalService.MOMO_WEBHOOK, Map.of(
                "qrwallet.momo.webhook-secret", nullToEmpty(properties.getMomo().getWebhookSecret())));
        return required;
    }

    private static Map<String, String> credentials(String product, WalletProperties.Credentials credentials) {
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("qrwallet.momo." + product + ".subscription-key", nullToEmpty(credentials.getSubscriptionKey()));
        keys.put("qrwallet.momo." + product + ".api-user", nullToEmpty(credentials.getApiUser()));
        keys.put("qrwallet.momo." + product + ".api-key", nullToEmpty(credentials.getApiKey()));
        return keys;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
