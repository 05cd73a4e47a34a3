package com.qrwallet.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed configuration of the wallet backend, bound from {@code qrwallet.*} and validated at startup.
 *
 * <p>Secrets are optional here: a missing secret disables the external service that needs it
 * (see {@link ServiceReadinessGate}) instead of preventing startup.
 */
@ConfigurationProperties(prefix = "qrwallet")
@Validated
@Getter
@Setter
public class WalletProperties {

    public enum Environment {
        SANDBOX,
        PRODUCTION
    }

    @NotNull
    private Environment environment = Environment.SANDBOX;

    @Valid
    private Paystack paystack = new Paystack();

    @Valid
    private Momo momo = new Momo();

    @Valid
    private Qr qr = new Qr();

    @Valid
    private Transfer transfer = new Transfer();

    @Valid
    private Withdrawal withdrawal = new Withdrawal();

    @Valid
    private Idempotency idempotency = new Idempotency();

    /**
     * Persistent per-user limits keyed by operation name (sendMoney, initiateWithdrawal, ...).
     */
    @Valid
    private Map<String, RateLimitRule> rateLimits = new LinkedHashMap<>();

    @Valid
    private Burst burst = new Burst();

    @Valid
    private ExchangeRates exchangeRates = new ExchangeRates();

    @Valid
    private Webhooks webhooks = new Webhooks();

    @Valid
    private Wallet wallet = new Wallet();

    public boolean isProduction() {
        return environment == Environment.PRODUCTION;
    }

    @Getter
    @Setter
    public static class Paystack {
        private String secretKey;

        @NotBlank
        private String baseUrl = "https://api.paystack.co";

        @NotBlank
        private String signatureHeader = "x-paystack-signature";

        @NotBlank
        private String defaultCurrency = "GHS";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Momo {
        @NotBlank
        private String baseUrl = "https://sandbox.momodeveloper.mtn.com";

        /**
         * Value of the X-Target-Environment header, e.g. {@code sandbox} or {@code mtnghana}.
         */
        @NotBlank
        private String targetEnvironment = "sandbox";

        private String callbackUrl;

        private String webhookSecret;

        @NotBlank
        private String defaultCurrency = "EUR";

        @Valid
        private Credentials collections = new Credentials();

        @Valid
        private Credentials disbursements = new Credentials();

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Credentials {
        private String subscriptionKey;
        private String apiUser;
        private String apiKey;
    }

    @Getter
    @Setter
    public static class Qr {
        private String secret;

        @NotNull
        private Duration expiry = Duration.ofMinutes(15);
    }

    @Getter
    @Setter
    public static class Transfer {
        @NotNull
        private BigDecimal maxAmount = new BigDecimal("10000000");

        @NotNull
        @DecimalMin("0")
        private BigDecimal feeRate = new BigDecimal("0.01");

        @NotNull
        private BigDecimal minFee = new BigDecimal("10");

        @NotNull
        private BigDecimal maxFee = new BigDecimal("100");

        /**
         * Maximum total debits per wallet per day; zero disables the check.
         */
        @NotNull
        private BigDecimal dailyLimit = BigDecimal.ZERO;
    }

    @Getter
    @Setter
    public static class Withdrawal {
        @NotNull
        private BigDecimal minimumAmount = new BigDecimal("100");
    }

    @Getter
    @Setter
    public static class Idempotency {
        @NotNull
        private Duration ttl = Duration.ofHours(24);

        @Min(1)
        private int minKeyLength = 16;

        @Min(1)
        private int cleanupBatchSize = 500;
    }

    @Getter
    @Setter
    public static class RateLimitRule {
        @NotNull
        private Duration window;

        @Min(1)
        private int maxRequests;

        private String message;
    }

    @Getter
    @Setter
    public static class Burst {
        @Min(1)
        private int requestsPerWindow = 100;

        @NotNull
        private Duration window = Duration.ofMinutes(1);

        @Min(1)
        private int failedLookupLimit = 10;

        @NotNull
        private Duration failedLookupWindow = Duration.ofMinutes(5);

        @Min(1)
        private long maxTrackedClients = 10_000;
    }

    @Getter
    @Setter
    public static class ExchangeRates {
        @NotBlank
        private String sourceUrl = "https://api.exchangerate.host/latest?base=USD";

        @NotBlank
        private String sourceName = "exchangerate.host";

        /**
         * Rates older than this are not used to convert money between wallets.
         */
        @NotNull
        private Duration maxStaleness = Duration.ofHours(48);

        @NotEmpty
        private List<String> supportedCurrencies = new ArrayList<>(List.of("USD", "GHS", "NGN", "EUR", "GBP"));
    }

    @Getter
    @Setter
    public static class Webhooks {
        /**
         * Outside production, process a callback on its own claims when the gateway status endpoint
         * cannot be reached. Ignored in production.
         */
        private boolean trustCallbackWhenUnverified = true;
    }

    @Getter
    @Setter
    public static class Wallet {
        @NotBlank
        private String defaultCurrency = "GHS";

        @NotBlank
        private String platformWalletId = "QRW-PLATFORM";
    }
}
