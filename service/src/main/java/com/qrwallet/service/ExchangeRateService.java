package com.qrwallet.service;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.rates.ExchangeRateClient;
import com.qrwallet.model.ExchangeRate;
import com.qrwallet.repository.ExchangeRateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Exchange rates against USD and currency conversion between wallets.
 *
 * <p>Converting money requires rates no older than the configured maximum staleness. Fee reporting in USD uses
 * whatever rate is stored, falling back to 1 for an unknown currency.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeRateService {

    static final String BASE_CURRENCY = "USD";

    private final ExchangeRateRepository exchangeRateRepository;
    private final ExchangeRateClient exchangeRateClient;
    private final WalletProperties properties;
    private final Clock clock;

    /**
     * Result of a conversion. {@code rate} is null when no conversion took place.
     */
    public record Conversion(BigDecimal amount, BigDecimal rate) {
        public boolean converted() {
            return rate != null;
        }
    }

    /**
     * Converts {@code amount} from one currency into another using fresh stored rates.
     *
     * @throws WalletException SERVICE_UNAVAILABLE if a rate is missing or stale
     */
    @Transactional(readOnly = true)
    public Conversion convert(BigDecimal amount, String fromCurrency, String toCurrency) {
        if (fromCurrency.equals(toCurrency)) {
            return new Conversion(amount, null);
        }
        BigDecimal fromRate = freshRate(fromCurrency);
        BigDecimal toRate = freshRate(toCurrency);
        BigDecimal rate = toRate.divide(fromRate, MathContext.DECIMAL64).setScale(10, RoundingMode.HALF_UP);
        BigDecimal converted = amount.multiply(rate).setScale(2, RoundingMode.HALF_UP);
        return new Conversion(converted, rate);
    }

    /**
     * Units of {@code currency} per USD for fee reporting. Stale rates are used with a warning; a missing rate is 1.
     */
    @Transactional(readOnly = true)
    public BigDecimal usdRateForAccounting(String currency) {
        if (BASE_CURRENCY.equals(currency)) {
            return BigDecimal.ONE;
        }
        ExchangeRate rate = exchangeRateRepository.findById(currency).orElse(null);
        if (rate == null || rate.getRate().signum() <= 0) {
            log.warn("No exchange rate for fee accounting, using 1: currency={}", currency);
            return BigDecimal.ONE;
        }
        if (isStale(rate)) {
            log.warn("Using stale exchange rate for fee accounting: currency={}, updatedAt={}",
                    currency, rate.getUpdatedAt());
        }
        return rate.getRate();
    }

    /**
     * Fetches rates from the source and replaces the stored supported-currency rates. USD is pinned to 1.
     *
     * @return Number of stored rates
     */
    @Transactional
    public int refreshRates() {
        Map<String, BigDecimal> fetched = exchangeRateClient.fetchUsdRates();
        Instant now = Instant.now(clock);
        String source = properties.getExchangeRates().getSourceName();

        List<ExchangeRate> rates = new ArrayList<>();
        for (String currency : properties.getExchangeRates().getSupportedCurrencies()) {
            BigDecimal value = BASE_CURRENCY.equals(currency) ? BigDecimal.ONE : fetched.get(currency);
            if (value == null || value.signum() <= 0) {
                log.warn("Exchange rate source has no rate: currency={}, source={}", currency, source);
                continue;
            }
            rates.add(new ExchangeRate(currency, value, now, source));
        }
        exchangeRateRepository.saveAll(rates);
        log.info("Exchange rates refreshed: count={}, source={}", rates.size(), source);
        return rates.size();
    }

    public boolean hasRates() {
        return exchangeRateRepository.count() > 0;
    }

    private BigDecimal freshRate(String currency) {
        if (BASE_CURRENCY.equals(currency)) {
            return BigDecimal.ONE;
        }
        ExchangeRate rate = exchangeRateRepository.findById(currency)
                .filter(r -> r.getRate().signum() > 0)
                .orElseThrow(() -> WalletException.of(ErrorCode.SERVICE_UNAVAILABLE,
                        "Exchange rates are temporarily unavailable. Please try again later.",
                        Map.of("currency", currency)));
        if (isStale(rate)) {
            log.error("Refusing to convert with stale exchange rate: currency={}, updatedAt={}",
                    currency, rate.getUpdatedAt());
            throw WalletException.of(ErrorCode.SERVICE_UNAVAILABLE,
                    "Exchange rates are temporarily unavailable. Please try again later.",
                    Map.of("currency", currency));
        }
        return rate.getRate();
    }

    private boolean isStale(ExchangeRate rate) {
        Instant oldestAcceptable = Instant.now(clock).minus(properties.getExchangeRates().getMaxStaleness());
        return rate.getUpdatedAt().isBefore(oldestAcceptable);
    }
}
