package com.qrwallet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.qrwallet.api.model.KycStatus;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import com.qrwallet.gateway.momo.MomoClient;
import com.qrwallet.gateway.paystack.PaystackClient;
import com.qrwallet.model.ExchangeRate;
import com.qrwallet.model.UserAccount;
import com.qrwallet.model.Wallet;
import com.qrwallet.repository.ExchangeRateRepository;
import com.qrwallet.repository.UserAccountRepository;
import com.qrwallet.repository.WalletRepository;
import com.qrwallet.security.CallerAuthenticationFilter;
import com.qrwallet.service.WalletProvisioningService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

/**
 * Spring context against an in-memory H2 database in PostgreSQL mode, with the payment gateways mocked.
 *
 * <p>Every test starts from empty tables (the platform wallet row is reset, not removed).
 */
@SpringBootTest(classes = QrWalletApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class TestBase {

    protected static final String PAYSTACK_SECRET = "sk_test_secret";
    protected static final String MOMO_WEBHOOK_SECRET = "momo-webhook-secret";

    private static final List<String> TABLES = List.of(
            "status_transitions", "platform_fee_records", "exchange_rates", "audit_logs", "rate_limits",
            "idempotency_keys", "payments", "momo_transactions", "withdrawals", "transaction_receipts",
            "wallets", "users");

    // Counter for generating unique user IDs in tests
    private static final AtomicLong userIdCounter = new AtomicLong(1);

    @MockBean
    protected PaystackClient paystackClient;

    @MockBean
    protected MomoClient momoClient;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected WalletProvisioningService walletProvisioningService;

    @Autowired
    protected WalletRepository walletRepository;

    @Autowired
    protected UserAccountRepository userAccountRepository;

    @Autowired
    protected ExchangeRateRepository exchangeRateRepository;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    public void cleanDatabase() {
        TABLES.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
        jdbcTemplate.update("UPDATE platform_wallet SET total_balance_usd = 0, total_transactions = 0, "
                + "total_fees_collected = 0");
    }

    protected static String newUserId() {
        return "user-" + userIdCounter.getAndIncrement();
    }

    protected static String newIdempotencyKey() {
        return "idem-" + UUID.randomUUID();
    }

    /**
     * Helper method to create a KYC-verified user with a wallet holding {@code balance}.
     */
    protected Wallet createVerifiedWallet(String userId, String fullName, String currency, String balance) {
        Wallet wallet = walletProvisioningService.provision(userId, fullName, userId + "@example.com", currency);
        setKycStatus(userId, KycStatus.VERIFIED);
        if (balance != null) {
            wallet.setBalance(new BigDecimal(balance));
            wallet = walletRepository.save(wallet);
        }
        return wallet;
    }

    protected void setKycStatus(String userId, KycStatus status) {
        UserAccount user = userAccountRepository.findById(userId).orElseThrow();
        user.setKycStatus(status);
        userAccountRepository.save(user);
    }

    protected BigDecimal balanceOf(String userId) {
        return walletRepository.findByOwnerId(userId).orElseThrow().getBalance();
    }

    /**
     * Units per USD, updated now.
     */
    protected void seedExchangeRate(String currency, String unitsPerUsd) {
        exchangeRateRepository.save(new ExchangeRate(currency, new BigDecimal(unitsPerUsd), Instant.now(), "test"));
    }

    protected static MockHttpServletRequestBuilder postAs(String userId, String url, Object... uriVariables) {
        return post(url, uriVariables)
                .header(CallerAuthenticationFilter.USER_HEADER, userId)
                .contentType(MediaType.APPLICATION_JSON);
    }

    protected static MockHttpServletRequestBuilder getAs(String userId, String url, Object... uriVariables) {
        return get(url, uriVariables).header(CallerAuthenticationFilter.USER_HEADER, userId);
    }

    protected String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    protected static GatewayResult gatewayResult(GatewayStatus status, String providerStatus,
                                                 String providerReference) {
        return gatewayResult(status, providerStatus, providerReference, JsonNodeFactory.instance.objectNode());
    }

    protected static GatewayResult gatewayResult(GatewayStatus status, String providerStatus,
                                                 String providerReference, JsonNode raw) {
        return new GatewayResult("test", status, providerStatus, providerReference, null, raw);
    }

    protected static String paystackSignature(byte[] body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(PAYSTACK_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
