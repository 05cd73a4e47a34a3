package com.qrwallet.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.ReceiptType;
import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.api.request.ChargeMobileMoneyRequest;
import com.qrwallet.api.request.InitializeTransactionRequest;
import com.qrwallet.api.response.BankAccountResponse;
import com.qrwallet.api.response.BankResponse;
import com.qrwallet.api.response.InitializeTransactionResponse;
import com.qrwallet.api.response.MobileMoneyChargeResponse;
import com.qrwallet.api.response.PaymentVerificationResponse;
import com.qrwallet.config.ExternalService;
import com.qrwallet.config.ServiceReadinessGate;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.paystack.PaystackClient;
import com.qrwallet.gateway.paystack.RestPaystackClient;
import com.qrwallet.model.Payment;
import com.qrwallet.model.TransactionReceipt;
import com.qrwallet.repository.PaymentRepository;
import com.qrwallet.repository.TransactionReceiptRepository;
import com.qrwallet.repository.WalletRepository;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wallet top-ups through the card/bank gateway and its bank directory.
 *
 * <p>Crediting is idempotent by payment reference: the {@link Payment} row is locked, and once it is marked
 * processed every later confirmation of the same reference (webhook redelivery, client verify) is inert.
 */
@Service
@Validated
@Slf4j
public class DepositService {

    static final String CHARGE_OPERATION = "chargeMobileMoney";
    static final String VERIFY_OPERATION = "verifyPayment";
    private static final String DEFAULT_BANK_COUNTRY = "nigeria";

    private final ServiceReadinessGate readinessGate;
    private final KycService kycService;
    private final IdempotencyService idempotencyService;
    private final WalletLedgerService ledgerService;
    private final TransactionStateService stateService;
    private final AuditLogService auditLogService;
    private final ReferenceGenerator referenceGenerator;
    private final PaystackClient paystackClient;
    private final PaymentRepository paymentRepository;
    private final WalletRepository walletRepository;
    private final TransactionReceiptRepository receiptRepository;
    private final WalletProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public DepositService(ServiceReadinessGate readinessGate,
                          KycService kycService,
                          IdempotencyService idempotencyService,
                          WalletLedgerService ledgerService,
                          TransactionStateService stateService,
                          AuditLogService auditLogService,
                          ReferenceGenerator referenceGenerator,
                          PaystackClient paystackClient,
                          PaymentRepository paymentRepository,
                          WalletRepository walletRepository,
                          TransactionReceiptRepository receiptRepository,
                          WalletProperties properties,
                          Clock clock,
                          PlatformTransactionManager transactionManager) {
        this.readinessGate = readinessGate;
        this.kycService = kycService;
        this.idempotencyService = idempotencyService;
        this.ledgerService = ledgerService;
        this.stateService = stateService;
        this.auditLogService = auditLogService;
        this.referenceGenerator = referenceGenerator;
        this.paystackClient = paystackClient;
        this.paymentRepository = paymentRepository;
        this.walletRepository = walletRepository;
        this.receiptRepository = receiptRepository;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Result of confirming a settled charge.
     *
     * @param credited   {@code false} if the reference had already been processed
     * @param newBalance Wallet balance after the credit, null when nothing was credited
     */
    public record Confirmation(boolean credited, BigDecimal newBalance) {
    }

    /**
     * Verifies a charge with the gateway and credits the caller's wallet once.
     */
    public PaymentVerificationResponse verifyPayment(String userId, String reference) {
        if (!StringUtils.hasText(reference)) {
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED, "Payment reference is required.");
        }
        readinessGate.requireReady(ExternalService.PAYSTACK);
        kycService.enforceKyc(userId);

        try {
            return executeVerification(userId, reference);
        } catch (WalletException e) {
            auditLogService.failure(userId, VERIFY_OPERATION, null, null, Map.of("reference", reference),
                    e.getCode() + ": " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Payment verification failed: userId={}, reference={}", userId, reference, e);
            auditLogService.failure(userId, VERIFY_OPERATION, null, null, Map.of("reference", reference),
                    e.getMessage());
            throw new WalletException(ErrorCode.SYSTEM_INTERNAL_ERROR, "Payment verification failed.", null, e);
        }
    }

    private PaymentVerificationResponse executeVerification(String userId, String reference) {
        GatewayResult verification = paystackClient.verifyTransaction(reference);
        if (!verification.isSuccess()) {
            log.info("Payment not successful at gateway: reference={}, gatewayStatus={}",
                    reference, verification.providerStatus());
            return new PaymentVerificationResponse(reference, false, false, null, null, null,
                    "Payment verification failed");
        }

        JsonNode data = verification.raw();
        String payer = paymentRepository.findById(reference)
                .map(Payment::getUserId)
                .orElseGet(() -> data.path("metadata").path("userId").asText(null));
        if (payer != null && !payer.equals(userId)) {
            throw WalletException.of(ErrorCode.AUTH_PERMISSION_DENIED, "This payment belongs to another user.",
                    Map.of("reference", reference));
        }

        BigDecimal amount = RestPaystackClient.fromMinorUnits(data.path("amount").asLong());
        String currency = data.path("currency").asText(properties.getPaystack().getDefaultCurrency());
        String channel = data.path("channel").asText(null);

        Confirmation confirmation = confirmPayment(reference, userId, amount, currency, channel,
                "Wallet top-up via Paystack");
        if (!confirmation.credited()) {
            return new PaymentVerificationResponse(reference, true, true, amount, currency, null,
                    "Payment already processed");
        }
        auditLogService.success(userId, VERIFY_OPERATION, amount, currency, Map.of("reference", reference));
        return new PaymentVerificationResponse(reference, true, false, amount, currency, confirmation.newBalance(),
                "Payment verified successfully");
    }

    /**
     * Starts a hosted card checkout and records the pending payment so the gateway callback can be matched to it.
     */
    public InitializeTransactionResponse initializeTransaction(String userId, @Valid InitializeTransactionRequest request) {
        readinessGate.requireReady(ExternalService.PAYSTACK);
        requirePositive(request.amount());
        kycService.enforceKyc(userId);

        String currency = StringUtils.hasText(request.currency())
                ? request.currency()
                : properties.getPaystack().getDefaultCurrency();
        String reference = referenceGenerator.cardPaymentReference();
        savePendingPayment(reference, userId, request.amount(), currency, "card");

        GatewayResult result = paystackClient.initializeTransaction(request.email(), request.amount(), currency,
                reference, Map.of("userId", userId, "type", "deposit"));
        if (result.isFailed()) {
            throw WalletException.of(ErrorCode.SERVICE_PAYSTACK_ERROR, "Failed to initialize payment.",
                    Map.of("reference", reference, "retryable", true));
        }

        log.info("Card payment initialized: reference={}, userId={}, amount={}, currency={}",
                reference, userId, request.amount(), currency);
        return new InitializeTransactionResponse(reference,
                result.raw().path("authorization_url").asText(null),
                result.raw().path("access_code").asText(null));
    }

    /**
     * Charges a mobile-money wallet through the card gateway. A charge that settles immediately is credited at
     * once; otherwise the payer approves it on their phone and the webhook credits it.
     */
    public MobileMoneyChargeResponse chargeMobileMoney(String userId, @Valid ChargeMobileMoneyRequest request) {
        readinessGate.requireReady(ExternalService.PAYSTACK);
        kycService.enforceKyc(userId);
        requirePositive(request.amount());
        if (!StringUtils.hasText(request.provider()) || !StringUtils.hasText(request.phoneNumber())) {
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED, "Provider and phone number are required.");
        }

        return idempotencyService.withIdempotency(request.idempotencyKey(), CHARGE_OPERATION, userId,
                MobileMoneyChargeResponse.class, () -> executeCharge(userId, request));
    }

    public List<BankResponse> getBanks(String country) {
        readinessGate.requireReady(ExternalService.PAYSTACK);
        return paystackClient.listBanks(StringUtils.hasText(country) ? country : DEFAULT_BANK_COUNTRY);
    }

    public BankAccountResponse verifyBankAccount(String accountNumber, String bankCode) {
        if (!StringUtils.hasText(accountNumber) || !StringUtils.hasText(bankCode)) {
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED, "Account number and bank code required.");
        }
        readinessGate.requireReady(ExternalService.PAYSTACK);
        return paystackClient.resolveAccount(accountNumber, bankCode);
    }

    /**
     * Credits a settled charge to its owner's wallet exactly once and writes the deposit receipt.
     *
     * @param amount   Charged amount in {@code currency}; converted into the wallet currency when they differ
     * @param currency Charge currency
     */
    public Confirmation confirmPayment(String reference, String userId, BigDecimal amount, String currency,
                                       String channel, String description) {
        try {
            Confirmation confirmation = transactionTemplate.execute(status ->
                    creditOnce(reference, userId, amount, currency, channel, description));
            if (confirmation != null && confirmation.credited()) {
                log.info("Deposit credited: reference={}, userId={}, amount={}, currency={}",
                        reference, userId, amount, currency);
            }
            return confirmation;
        } catch (DataIntegrityViolationException e) {
            // a concurrent confirmation inserted the payment first and did the credit
            log.info("Deposit already confirmed concurrently: reference={}", reference);
            return new Confirmation(false, null);
        }
    }

    /**
     * Marks a payment as failed at the gateway. Processed payments are left untouched.
     */
    public void markPaymentFailed(String reference, String gatewayStatus) {
        transactionTemplate.executeWithoutResult(status -> paymentRepository.getOneForUpdate(reference)
                .filter(payment -> !payment.isProcessed())
                .ifPresent(payment -> payment.setGatewayStatus(gatewayStatus)));
    }

    private Confirmation creditOnce(String reference, String userId, BigDecimal amount, String currency,
                                    String channel, String description) {
        Payment payment = paymentRepository.getOneForUpdate(reference).orElse(null);
        if (payment != null && payment.isProcessed()) {
            return new Confirmation(false, null);
        }
        Instant now = Instant.now(clock);
        if (payment == null) {
            payment = new Payment();
            payment.setReference(reference);
            payment.setUserId(userId);
            payment.setAmount(amount);
            payment.setCurrency(currency);
            payment.setCreatedAt(now);
        }

        WalletLedgerService.Posting posting = ledgerService.creditOwner(userId, amount, currency);

        payment.setWalletId(posting.wallet().getWalletId());
        payment.setCreditedAmount(posting.walletAmount());
        payment.setChannel(channel);
        payment.setGatewayStatus("success");
        payment.setProcessed(true);
        payment.setProcessedAt(now);
        paymentRepository.save(payment);

        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setTransactionId(reference);
        receipt.setOwnerId(userId);
        receipt.setType(ReceiptType.DEPOSIT);
        receipt.setReceiverWalletId(posting.wallet().getWalletId());
        receipt.setAmount(amount);
        receipt.setCurrency(currency);
        receipt.setReceiverCurrency(posting.wallet().getCurrency());
        receipt.setExchangeRate(posting.rate());
        receipt.setConvertedAmount(posting.rate() != null ? posting.walletAmount() : null);
        receipt.setReference(reference);
        receipt.setDescription(description);
        receipt.setMethod(channel);
        receipt.setStatus(TransactionStatus.COMPLETED);
        receipt.setCreatedAt(now);
        receipt.setCompletedAt(now);
        receiptRepository.save(receipt);
        stateService.recordCreation(receipt);

        return new Confirmation(true, posting.wallet().getBalance());
    }

    private MobileMoneyChargeResponse executeCharge(String userId, ChargeMobileMoneyRequest request) {
        String currency = StringUtils.hasText(request.currency())
                ? request.currency()
                : properties.getPaystack().getDefaultCurrency();
        String reference = referenceGenerator.mobileMoneyChargeReference();
        savePendingPayment(reference, userId, request.amount(), currency, "mobile_money");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", userId);
        metadata.put("type", "deposit");

        GatewayResult charge;
        try {
            charge = paystackClient.chargeMobileMoney(request.email(), request.amount(), currency,
                    request.phoneNumber(), request.provider(), reference, metadata);
        } catch (WalletException e) {
            auditLogService.failure(userId, CHARGE_OPERATION, request.amount(), currency,
                    Map.of("reference", reference), e.getCode() + ": " + e.getMessage());
            throw e;
        }

        if (charge.isFailed()) {
            markPaymentFailed(reference, "failed");
            auditLogService.failure(userId, CHARGE_OPERATION, request.amount(), currency,
                    Map.of("reference", reference), charge.message());
            throw WalletException.of(ErrorCode.SERVICE_PAYSTACK_ERROR,
                    "Mobile money charge failed.", Map.of("reference", reference, "retryable", true));
        }

        if (charge.isSuccess()) {
            confirmPayment(reference, userId, request.amount(), currency, "mobile_money", "Mobile Money deposit");
            auditLogService.success(userId, CHARGE_OPERATION, request.amount(), currency,
                    Map.of("reference", reference, "completed", true));
            return new MobileMoneyChargeResponse(reference, charge.providerStatus(), true, "Payment successful!", null);
        }

        transactionTemplate.executeWithoutResult(status -> paymentRepository.getOneForUpdate(reference)
                .ifPresent(payment -> payment.setGatewayStatus(charge.providerStatus())));
        auditLogService.success(userId, CHARGE_OPERATION, request.amount(), currency,
                Map.of("reference", reference, "completed", false));
        return new MobileMoneyChargeResponse(reference, charge.providerStatus(), false,
                "Payment initiated. Please approve on your phone.", null);
    }

    private void savePendingPayment(String reference, String userId, BigDecimal amount, String currency,
                                    String channel) {
        String walletId = walletRepository.findByOwnerId(userId)
                .orElseThrow(() -> WalletException.of(ErrorCode.WALLET_NOT_FOUND))
                .getWalletId();

        Payment payment = new Payment();
        payment.setReference(reference);
        payment.setUserId(userId);
        payment.setWalletId(walletId);
        payment.setAmount(amount);
        payment.setCurrency(currency);
        payment.setChannel(channel);
        payment.setGatewayStatus("pending");
        payment.setCreatedAt(Instant.now(clock));
        transactionTemplate.executeWithoutResult(status -> paymentRepository.save(payment));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw WalletException.of(ErrorCode.TXN_AMOUNT_INVALID, "Amount must be positive.");
        }
    }
}
