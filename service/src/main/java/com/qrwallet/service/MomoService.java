package com.qrwallet.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.MomoProduct;
import com.qrwallet.api.model.ReceiptType;
import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.api.request.MomoPaymentRequest;
import com.qrwallet.api.response.MomoBalanceResponse;
import com.qrwallet.api.response.MomoTransactionResponse;
import com.qrwallet.config.ExternalService;
import com.qrwallet.config.ServiceReadinessGate;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import com.qrwallet.gateway.momo.MomoClient;
import com.qrwallet.model.MomoTransaction;
import com.qrwallet.model.TransactionReceipt;
import com.qrwallet.model.Wallet;
import com.qrwallet.repository.MomoTransactionRepository;
import com.qrwallet.repository.TransactionReceiptRepository;
import com.qrwallet.repository.WalletRepository;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Mobile-money collections (top-ups) and disbursements (payouts).
 *
 * <p>Both are asynchronous at the provider. A collection credits the wallet only when the provider reports it
 * SUCCESSFUL; a disbursement debits the wallet up front and is refunded when the provider reports it FAILED.
 * {@link #applyProviderStatus} is the single place where a verified provider status is applied, used by both the
 * status check and the provider callback.
 */
@Service
@Validated
@Slf4j
public class MomoService {

    static final String COLLECTION_OPERATION = "momoRequestToPay";
    static final String DISBURSEMENT_OPERATION = "momoTransfer";
    private static final String METHOD = "MTN MoMo";

    private final ServiceReadinessGate readinessGate;
    private final KycService kycService;
    private final RateLimitService rateLimitService;
    private final IdempotencyService idempotencyService;
    private final WalletLedgerService ledgerService;
    private final TransactionStateMachine stateMachine;
    private final TransactionStateService stateService;
    private final AuditLogService auditLogService;
    private final ReferenceGenerator referenceGenerator;
    private final MomoClient momoClient;
    private final MomoTransactionRepository momoTransactionRepository;
    private final WalletRepository walletRepository;
    private final TransactionReceiptRepository receiptRepository;
    private final WalletProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public MomoService(ServiceReadinessGate readinessGate,
                       KycService kycService,
                       RateLimitService rateLimitService,
                       IdempotencyService idempotencyService,
                       WalletLedgerService ledgerService,
                       TransactionStateMachine stateMachine,
                       TransactionStateService stateService,
                       AuditLogService auditLogService,
                       ReferenceGenerator referenceGenerator,
                       MomoClient momoClient,
                       MomoTransactionRepository momoTransactionRepository,
                       WalletRepository walletRepository,
                       TransactionReceiptRepository receiptRepository,
                       WalletProperties properties,
                       Clock clock,
                       PlatformTransactionManager transactionManager) {
        this.readinessGate = readinessGate;
        this.kycService = kycService;
        this.rateLimitService = rateLimitService;
        this.idempotencyService = idempotencyService;
        this.ledgerService = ledgerService;
        this.stateMachine = stateMachine;
        this.stateService = stateService;
        this.auditLogService = auditLogService;
        this.referenceGenerator = referenceGenerator;
        this.momoClient = momoClient;
        this.momoTransactionRepository = momoTransactionRepository;
        this.walletRepository = walletRepository;
        this.receiptRepository = receiptRepository;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Outcome of applying a provider status.
     *
     * @param transaction The transaction after the update
     * @param changed     {@code true} if the status moved (and money moved with it where applicable)
     */
    public record Applied(MomoTransaction transaction, boolean changed) {
    }

    /**
     * Asks the payer to approve a payment on their phone.
     */
    public MomoTransactionResponse requestToPay(String userId, @Valid MomoPaymentRequest request) {
        readinessGate.requireReady(ExternalService.MOMO_COLLECTIONS);
        validate(request);
        kycService.enforceKyc(userId);
        rateLimitService.enforceRateLimit(userId, COLLECTION_OPERATION);

        return idempotencyService.withIdempotency(request.idempotencyKey(), COLLECTION_OPERATION, userId,
                MomoTransactionResponse.class, () -> executeCollection(userId, request));
    }

    /**
     * Pays out from the caller's wallet to a mobile-money number.
     */
    public MomoTransactionResponse transfer(String userId, @Valid MomoPaymentRequest request) {
        readinessGate.requireReady(ExternalService.MOMO_DISBURSEMENTS);
        validate(request);
        kycService.enforceKyc(userId);
        rateLimitService.enforceRateLimit(userId, DISBURSEMENT_OPERATION);

        return idempotencyService.withIdempotency(request.idempotencyKey(), DISBURSEMENT_OPERATION, userId,
                MomoTransactionResponse.class, () -> executeDisbursement(userId, request));
    }

    /**
     * Queries the provider for one of the caller's transactions and applies the reported status.
     *
     * @throws WalletException TXN_NOT_FOUND, AUTH_PERMISSION_DENIED if it belongs to another user
     */
    public MomoTransactionResponse checkStatus(String userId, String referenceId) {
        kycService.enforceKyc(userId);
        MomoTransaction transaction = momoTransactionRepository.findById(referenceId)
                .orElseThrow(() -> WalletException.of(ErrorCode.TXN_NOT_FOUND, null,
                        Map.of("referenceId", referenceId)));
        if (!transaction.getUserId().equals(userId)) {
            throw WalletException.of(ErrorCode.AUTH_PERMISSION_DENIED, null, Map.of("referenceId", referenceId));
        }
        readinessGate.requireReady(readinessFor(transaction.getType()));

        GatewayResult result = momoClient.getStatus(transaction.getType(), referenceId);
        if (result.status() == GatewayStatus.UNKNOWN) {
            log.warn("MoMo status unavailable: referenceId={}", referenceId);
            return toResponse(transaction, result.message());
        }

        Applied applied = applyProviderStatus(referenceId, result.status(), result.providerStatus(),
                result.providerReference(), null, result.message());
        return toResponse(applied.transaction(), null);
    }

    public MomoBalanceResponse getBalance(String product) {
        MomoProduct momoProduct = MomoProduct.fromValue(product);
        readinessGate.requireReady(readinessFor(momoProduct));
        return momoClient.getBalance(momoProduct);
    }

    /**
     * Applies a status verified with the provider to a transaction, in one transaction with the money movement.
     *
     * <p>SUCCESSFUL completes the transaction and credits the wallet for a collection. FAILED fails it and
     * refunds the wallet once for a disbursement. Statuses that are already applied, not final, or not allowed
     * from the current state change nothing.
     *
     * @param verified               Normalised status from the provider status endpoint
     * @param providerStatus         Raw status string reported by the provider
     * @param financialTransactionId Provider transaction id, may be null
     * @param callbackStatus         Status claimed by the callback body, null when not called from a callback
     * @param failureReason          Provider failure reason, may be null
     * @throws WalletException TXN_NOT_FOUND for an unknown reference id
     */
    public Applied applyProviderStatus(String referenceId, GatewayStatus verified, String providerStatus,
                                       String financialTransactionId, String callbackStatus, String failureReason) {
        Applied applied = transactionTemplate.execute(status -> {
            MomoTransaction transaction = momoTransactionRepository.getOneForUpdate(referenceId)
                    .orElseThrow(() -> WalletException.of(ErrorCode.TXN_NOT_FOUND, null,
                            Map.of("referenceId", referenceId)));

            Instant now = Instant.now(clock);
            transaction.setProviderStatus(providerStatus);
            transaction.setVerifiedStatus(providerStatus);
            if (callbackStatus != null) {
                transaction.setCallbackStatus(callbackStatus);
            }
            if (financialTransactionId != null) {
                transaction.setFinancialTransactionId(financialTransactionId);
            }
            transaction.setUpdatedAt(now);

            Optional<TransactionStatus> target = finalStatusOf(verified);
            if (target.isEmpty() || target.get() == transaction.getStatus()) {
                return new Applied(transaction, false);
            }
            if (!stateMachine.isTransitionAllowed(transaction.getStatus(), target.get())) {
                log.warn("MoMo status not applicable: referenceId={}, current={}, reported={}",
                        referenceId, transaction.getStatus(), providerStatus);
                return new Applied(transaction, false);
            }

            if (target.get() == TransactionStatus.COMPLETED) {
                complete(transaction, now);
            } else {
                fail(transaction, failureReason, now);
            }
            return new Applied(transaction, true);
        });

        if (applied.changed()) {
            MomoTransaction transaction = applied.transaction();
            log.info("MoMo transaction {}: referenceId={}, type={}, amount={}, currency={}",
                    transaction.getStatus().value(), referenceId, transaction.getType().value(),
                    transaction.getAmount(), transaction.getCurrency());
        }
        return applied;
    }

    private MomoTransactionResponse executeCollection(String userId, MomoPaymentRequest request) {
        Wallet wallet = walletRepository.findByOwnerId(userId)
                .orElseThrow(() -> WalletException.of(ErrorCode.WALLET_NOT_FOUND));
        String currency = currencyOf(request);
        String referenceId = referenceGenerator.momoReferenceId();

        transactionTemplate.executeWithoutResult(status -> {
            MomoTransaction transaction = newTransaction(referenceId, MomoProduct.COLLECTION, userId, request, currency);
            transaction.setWalletCurrency(wallet.getCurrency());
            momoTransactionRepository.save(transaction);
            stateService.recordCreation(transaction);
        });

        GatewayResult result;
        try {
            result = momoClient.requestToPay(referenceId, request.amount(), currency, request.phoneNumber(),
                    messageOr(request.payerMessage(), "Add money to wallet"),
                    messageOr(request.payeeNote(), "Wallet top-up"));
        } catch (WalletException e) {
            auditLogService.failure(userId, COLLECTION_OPERATION, request.amount(), currency,
                    Map.of("referenceId", referenceId), e.getCode() + ": " + e.getMessage());
            throw e;
        }

        if (result.isFailed()) {
            stateService.updateState(() -> lock(referenceId), TransactionStatus.FAILED, transaction -> {
                transaction.setProviderStatus("FAILED");
                transaction.setFailureReason(truncate(result.message(), 1000));
                transaction.setUpdatedAt(Instant.now(clock));
            });
            auditLogService.failure(userId, COLLECTION_OPERATION, request.amount(), currency,
                    Map.of("referenceId", referenceId), result.message());
            throw WalletException.of(ErrorCode.SERVICE_MOMO_ERROR, "Payment request failed.",
                    Map.of("referenceId", referenceId, "retryable", true));
        }

        auditLogService.success(userId, COLLECTION_OPERATION, request.amount(), currency,
                Map.of("referenceId", referenceId, "phoneNumber", request.phoneNumber()));
        log.info("MoMo collection requested: referenceId={}, userId={}, amount={}, currency={}",
                referenceId, userId, request.amount(), currency);
        return new MomoTransactionResponse(referenceId, MomoProduct.COLLECTION, TransactionStatus.PENDING,
                request.amount(), currency, result.providerStatus(), "Please approve the payment on your phone", null);
    }

    private MomoTransactionResponse executeDisbursement(String userId, MomoPaymentRequest request) {
        String currency = currencyOf(request);
        String referenceId = referenceGenerator.momoReferenceId();

        transactionTemplate.executeWithoutResult(status -> debitAndRecord(userId, request, currency, referenceId));

        GatewayResult requested;
        try {
            requested = momoClient.transfer(referenceId, request.amount(), currency, request.phoneNumber(),
                    messageOr(request.payerMessage(), "Wallet withdrawal"),
                    messageOr(request.payeeNote(), "Withdrawal from wallet"));
        } catch (WalletException e) {
            log.warn("MoMo disbursement request failed, checking status: referenceId={}, error={}",
                    referenceId, e.getMessage());
            requested = statusAfterFailedDisbursement(referenceId, e);
        }
        GatewayResult result = requested;

        if (result.isFailed()) {
            transactionTemplate.executeWithoutResult(status -> {
                MomoTransaction transaction = lock(referenceId);
                transaction.setProviderStatus("FAILED");
                fail(transaction, result.message(), Instant.now(clock));
            });
            auditLogService.failure(userId, DISBURSEMENT_OPERATION, request.amount(), currency,
                    Map.of("referenceId", referenceId, "refunded", true), result.message());
            throw WalletException.of(ErrorCode.SERVICE_MOMO_ERROR, "Withdrawal failed.",
                    Map.of("referenceId", referenceId, "refunded", true, "retryable", true));
        }

        auditLogService.success(userId, DISBURSEMENT_OPERATION, request.amount(), currency,
                Map.of("referenceId", referenceId, "phoneNumber", request.phoneNumber()));
        return new MomoTransactionResponse(referenceId, MomoProduct.DISBURSEMENT, TransactionStatus.PENDING,
                request.amount(), currency, result.providerStatus(), "Withdrawal is being processed", null);
    }

    private void debitAndRecord(String userId, MomoPaymentRequest request, String currency, String referenceId) {
        WalletLedgerService.Posting posting = ledgerService.debitOwner(userId, request.amount(), currency);
        Wallet wallet = posting.wallet();
        Instant now = Instant.now(clock);

        MomoTransaction transaction = newTransaction(referenceId, MomoProduct.DISBURSEMENT, userId, request, currency);
        transaction.setWalletAmount(posting.walletAmount());
        transaction.setWalletCurrency(wallet.getCurrency());
        momoTransactionRepository.save(transaction);
        stateService.recordCreation(transaction);

        TransactionReceipt receipt = receipt(transaction, ReceiptType.WITHDRAWAL, wallet, posting, now);
        receipt.setSenderWalletId(wallet.getWalletId());
        receipt.setStatus(TransactionStatus.PENDING);
        receiptRepository.save(receipt);
        stateService.recordCreation(receipt);

        log.info("MoMo disbursement debited: referenceId={}, walletId={}, walletAmount={}, walletCurrency={}",
                referenceId, wallet.getWalletId(), posting.walletAmount(), wallet.getCurrency());
    }

    private void complete(MomoTransaction transaction, Instant now) {
        stateService.transition(transaction, TransactionStatus.COMPLETED);

        if (transaction.getType() == MomoProduct.COLLECTION) {
            WalletLedgerService.Posting posting = ledgerService.creditOwner(
                    transaction.getUserId(), transaction.getAmount(), transaction.getCurrency());
            transaction.setWalletAmount(posting.walletAmount());
            transaction.setWalletCurrency(posting.wallet().getCurrency());

            TransactionReceipt receipt = receipt(transaction, ReceiptType.DEPOSIT, posting.wallet(), posting, now);
            receipt.setReceiverWalletId(posting.wallet().getWalletId());
            receipt.setStatus(TransactionStatus.COMPLETED);
            receipt.setCompletedAt(now);
            receiptRepository.save(receipt);
            stateService.recordCreation(receipt);
        } else {
            receiptRepository.getOneForUpdate(transaction.getReferenceId(), transaction.getUserId())
                    .filter(receipt -> receipt.getStatus() != TransactionStatus.COMPLETED)
                    .ifPresent(receipt -> {
                        stateService.transition(receipt, TransactionStatus.COMPLETED);
                        receipt.setCompletedAt(now);
                    });
        }
    }

    /**
     * Status of a disbursement whose request failed. Only a transfer the provider reports as pending or successful
     * is kept; an unknown reference or an unreachable provider counts as failed.
     */
    private GatewayResult statusAfterFailedDisbursement(String referenceId, WalletException requestError) {
        GatewayResult status = null;
        try {
            status = momoClient.getStatus(MomoProduct.DISBURSEMENT, referenceId);
        } catch (WalletException e) {
            log.warn("MoMo disbursement status unavailable: referenceId={}, error={}", referenceId, e.getMessage());
        }
        if (status != null && (status.status() == GatewayStatus.SUCCESS || status.status() == GatewayStatus.PENDING)) {
            log.info("Provider holds the disbursement despite the failed request: referenceId={}, providerStatus={}",
                    referenceId, status.providerStatus());
            return status;
        }
        return new GatewayResult("momo", GatewayStatus.FAILED, status != null ? status.providerStatus() : null, null,
                requestError.getCode() + ": " + requestError.getMessage(), JsonNodeFactory.instance.objectNode());
    }

    private void fail(MomoTransaction transaction, String failureReason, Instant now) {
        if (transaction.getType() == MomoProduct.DISBURSEMENT && !transaction.isRefunded()) {
            ledgerService.refundOwner(transaction.getUserId(), transaction.getWalletAmount());
            transaction.setRefunded(true);
        }
        if (transaction.getStatus() != TransactionStatus.FAILED) {
            stateService.transition(transaction, TransactionStatus.FAILED);
        }
        transaction.setFailureReason(truncate(failureReason, 1000));
        transaction.setUpdatedAt(now);

        receiptRepository.getOneForUpdate(transaction.getReferenceId(), transaction.getUserId())
                .filter(receipt -> receipt.getStatus() != TransactionStatus.FAILED)
                .ifPresent(receipt -> {
                    stateService.transition(receipt, TransactionStatus.FAILED);
                    receipt.setFailureReason(truncate(failureReason, 255));
                });
    }

    private MomoTransaction newTransaction(String referenceId, MomoProduct type, String userId,
                                           MomoPaymentRequest request, String currency) {
        Instant now = Instant.now(clock);
        MomoTransaction transaction = new MomoTransaction();
        transaction.setReferenceId(referenceId);
        transaction.setType(type);
        transaction.setUserId(userId);
        transaction.setAmount(request.amount());
        transaction.setCurrency(currency);
        transaction.setPhoneNumber(request.phoneNumber());
        transaction.setStatus(TransactionStatus.PENDING);
        transaction.setProviderStatus("PENDING");
        transaction.setCreatedAt(now);
        transaction.setUpdatedAt(now);
        return transaction;
    }

    private TransactionReceipt receipt(MomoTransaction transaction, ReceiptType type, Wallet wallet,
                                       WalletLedgerService.Posting posting, Instant now) {
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setTransactionId(transaction.getReferenceId());
        receipt.setOwnerId(transaction.getUserId());
        receipt.setType(type);
        receipt.setAmount(transaction.getAmount());
        receipt.setCurrency(transaction.getCurrency());
        receipt.setReceiverCurrency(wallet.getCurrency());
        receipt.setExchangeRate(posting.rate());
        receipt.setConvertedAmount(posting.rate() != null ? posting.walletAmount() : null);
        receipt.setReference(transaction.getReferenceId());
        receipt.setDescription(type == ReceiptType.DEPOSIT ? "MTN MoMo deposit" : "MTN MoMo withdrawal");
        receipt.setMethod(METHOD);
        receipt.setCreatedAt(now);
        return receipt;
    }

    private MomoTransaction lock(String referenceId) {
        return momoTransactionRepository.getOneForUpdate(referenceId)
                .orElseThrow(() -> WalletException.of(ErrorCode.TXN_NOT_FOUND, null, Map.of("referenceId", referenceId)));
    }

    private void validate(MomoPaymentRequest request) {
        if (request.amount() == null || request.amount().signum() <= 0) {
            throw WalletException.of(ErrorCode.TXN_AMOUNT_INVALID, "Amount must be positive.");
        }
        if (!StringUtils.hasText(request.phoneNumber())) {
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED, "Phone number is required.");
        }
    }

    private String currencyOf(MomoPaymentRequest request) {
        return StringUtils.hasText(request.currency()) ? request.currency() : properties.getMomo().getDefaultCurrency();
    }

    private static String truncate(String value, int maxLength) {
        return value == null || value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private static String messageOr(String message, String fallback) {
        return StringUtils.hasText(message) ? message : fallback;
    }

    private static Optional<TransactionStatus> finalStatusOf(GatewayStatus status) {
        return switch (status) {
            case SUCCESS -> Optional.of(TransactionStatus.COMPLETED);
            case FAILED -> Optional.of(TransactionStatus.FAILED);
            default -> Optional.empty();
        };
    }

    private static ExternalService readinessFor(MomoProduct product) {
        return product == MomoProduct.COLLECTION ? ExternalService.MOMO_COLLECTIONS : ExternalService.MOMO_DISBURSEMENTS;
    }

    private static MomoTransactionResponse toResponse(MomoTransaction transaction, String message) {
        return new MomoTransactionResponse(transaction.getReferenceId(), transaction.getType(), transaction.getStatus(),
                transaction.getAmount(), transaction.getCurrency(), transaction.getProviderStatus(), message, null);
    }
}
