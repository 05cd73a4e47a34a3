package com.qrwallet.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.ReceiptType;
import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.api.model.WithdrawalType;
import com.qrwallet.api.request.FinalizeTransferRequest;
import com.qrwallet.api.request.WithdrawalRequest;
import com.qrwallet.api.response.FinalizeTransferResponse;
import com.qrwallet.api.response.WithdrawalResponse;
import com.qrwallet.config.ExternalService;
import com.qrwallet.config.ServiceReadinessGate;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.gateway.GatewayResult;
import com.qrwallet.gateway.GatewayStatus;
import com.qrwallet.gateway.paystack.PaystackClient;
import com.qrwallet.model.TransactionReceipt;
import com.qrwallet.model.Wallet;
import com.qrwallet.model.Withdrawal;
import com.qrwallet.repository.TransactionReceiptRepository;
import com.qrwallet.repository.WalletRepository;
import com.qrwallet.repository.WithdrawalRepository;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payouts from a wallet to a bank account or mobile-money number through the card/bank gateway.
 *
 * <p>The flow is saga-style: the payout recipient is created at the gateway, then the wallet is debited and a
 * pending withdrawal recorded in one transaction, then the transfer is requested. A transfer the gateway rejects
 * is compensated by crediting the wallet back. When the request itself fails (timeout, network error) the payout
 * status is queried: a payout the gateway holds stays pending until the webhook reports it, anything else is
 * refunded like a rejection.
 */
@Service
@Validated
@Slf4j
public class WithdrawalService {

    static final String OPERATION = "initiateWithdrawal";
    static final String FINALIZE_OPERATION = "finalizeTransfer";

    private final ServiceReadinessGate readinessGate;
    private final KycService kycService;
    private final RateLimitService rateLimitService;
    private final IdempotencyService idempotencyService;
    private final WalletLedgerService ledgerService;
    private final TransactionStateMachine stateMachine;
    private final TransactionStateService stateService;
    private final AuditLogService auditLogService;
    private final ReferenceGenerator referenceGenerator;
    private final PaystackClient paystackClient;
    private final WalletRepository walletRepository;
    private final WithdrawalRepository withdrawalRepository;
    private final TransactionReceiptRepository receiptRepository;
    private final WalletProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public WithdrawalService(ServiceReadinessGate readinessGate,
                             KycService kycService,
                             RateLimitService rateLimitService,
                             IdempotencyService idempotencyService,
                             WalletLedgerService ledgerService,
                             TransactionStateMachine stateMachine,
                             TransactionStateService stateService,
                             AuditLogService auditLogService,
                             ReferenceGenerator referenceGenerator,
                             PaystackClient paystackClient,
                             WalletRepository walletRepository,
                             WithdrawalRepository withdrawalRepository,
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
        this.paystackClient = paystackClient;
        this.walletRepository = walletRepository;
        this.withdrawalRepository = withdrawalRepository;
        this.receiptRepository = receiptRepository;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Starts a payout of {@code amount} (wallet currency) to a bank account or mobile-money number.
     *
     * @return Reference of the pending withdrawal; {@code requiresOtp} when the gateway holds the payout for an OTP
     * @throws WalletException CONFIG_MISSING, KYC_REQUIRED, RATE_LIMIT_EXCEEDED, TXN_AMOUNT_INVALID,
     *                         TXN_AMOUNT_TOO_SMALL, WALLET_INSUFFICIENT_FUNDS, SERVICE_PAYSTACK_ERROR, ...
     */
    public WithdrawalResponse initiateWithdrawal(String userId, @Valid WithdrawalRequest request) {
        readinessGate.requireReady(ExternalService.PAYSTACK);
        kycService.enforceKyc(userId);
        rateLimitService.enforceRateLimit(userId, OPERATION);

        BigDecimal amount = request.amount();
        if (amount == null || amount.signum() <= 0) {
            throw WalletException.of(ErrorCode.TXN_AMOUNT_INVALID, "Amount must be positive.");
        }
        BigDecimal minimum = properties.getWithdrawal().getMinimumAmount();
        if (amount.compareTo(minimum) < 0) {
            throw WalletException.of(ErrorCode.TXN_AMOUNT_TOO_SMALL,
                    "Minimum withdrawal is " + minimum.stripTrailingZeros().toPlainString() + ".",
                    Map.of("minimumAmount", minimum));
        }
        WithdrawalType type = request.type() == null ? WithdrawalType.BANK : request.type();
        requireDestination(type, request);

        return idempotencyService.withIdempotency(request.idempotencyKey(), OPERATION, userId,
                WithdrawalResponse.class, () -> executeWithdrawal(userId, type, request));
    }

    /**
     * Confirms an OTP-gated payout.
     *
     * @throws WalletException TXN_NOT_FOUND if the caller has no withdrawal with this transfer code,
     *                         TXN_INVALID_STATE if it is not waiting for an OTP
     */
    public FinalizeTransferResponse finalizeTransfer(String userId, @Valid FinalizeTransferRequest request) {
        readinessGate.requireReady(ExternalService.PAYSTACK);
        kycService.enforceKyc(userId);

        if (!StringUtils.hasText(request.transferCode()) || !StringUtils.hasText(request.otp())) {
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED, "Transfer code and OTP are required.");
        }

        return idempotencyService.withIdempotency(request.idempotencyKey(), FINALIZE_OPERATION, userId,
                FinalizeTransferResponse.class, () -> executeFinalize(userId, request));
    }

    /**
     * Marks a payout completed after the gateway confirmed it.
     *
     * @return {@code false} if the withdrawal was already completed
     */
    public boolean completeWithdrawal(String reference) {
        Boolean changed = transactionTemplate.execute(status -> {
            Withdrawal withdrawal = lockWithdrawal(reference);
            if (withdrawal.getStatus() == TransactionStatus.COMPLETED) {
                return false;
            }
            Instant now = Instant.now(clock);
            stateService.transition(withdrawal, TransactionStatus.COMPLETED);
            withdrawal.setCompletedAt(now);

            receiptRepository.getOneForUpdate(reference, withdrawal.getUserId()).ifPresent(receipt -> {
                stateService.transition(receipt, TransactionStatus.COMPLETED);
                receipt.setCompletedAt(now);
            });
            return true;
        });

        if (Boolean.TRUE.equals(changed)) {
            log.info("Withdrawal completed: reference={}", reference);
        }
        return Boolean.TRUE.equals(changed);
    }

    /**
     * Marks a payout failed after the gateway reported it failed or reversed, crediting the wallet back once.
     *
     * @return {@code false} if the withdrawal was already failed and refunded
     */
    public boolean failWithdrawal(String reference, String reason) {
        Boolean changed = transactionTemplate.execute(status -> {
            Withdrawal withdrawal = lockWithdrawal(reference);
            if (withdrawal.getStatus() == TransactionStatus.FAILED && withdrawal.isRefunded()) {
                return false;
            }
            refundAndFail(withdrawal, StringUtils.hasText(reason) ? reason : "Transfer failed");
            return true;
        });
        return Boolean.TRUE.equals(changed);
    }

    private WithdrawalResponse executeWithdrawal(String userId, WithdrawalType type, WithdrawalRequest request) {
        BigDecimal amount = request.amount();
        Wallet wallet = walletRepository.findByOwnerId(userId)
                .orElseThrow(() -> WalletException.of(ErrorCode.WALLET_NOT_FOUND));

        // early check so no recipient is created for a payout that cannot be funded; the debit re-checks under lock
        if (wallet.getBalance().compareTo(amount) < 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("walletId", wallet.getWalletId());
            details.put("required", amount);
            details.put("available", wallet.getBalance());
            throw WalletException.of(ErrorCode.WALLET_INSUFFICIENT_FUNDS, null, details);
        }

        String reference = referenceGenerator.withdrawalReference();
        try {
            String recipientCode = createRecipient(type, request, wallet.getCurrency(), reference);

            transactionTemplate.executeWithoutResult(status ->
                    debitAndRecord(userId, type, request, reference, recipientCode));

            WithdrawalResponse response = requestTransfer(reference, recipientCode, amount);

            auditLogService.success(userId, OPERATION, amount, wallet.getCurrency(), Map.of(
                    "reference", reference,
                    "type", type.value(),
                    "requiresOtp", response.requiresOtp()));
            return response;
        } catch (WalletException e) {
            auditLogService.failure(userId, OPERATION, amount, wallet.getCurrency(),
                    Map.of("reference", reference, "type", type.value()), e.getCode() + ": " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Withdrawal failed: userId={}, reference={}, amount={}", userId, reference, amount, e);
            auditLogService.failure(userId, OPERATION, amount, wallet.getCurrency(),
                    Map.of("reference", reference, "type", type.value()), e.getMessage());
            throw new WalletException(ErrorCode.SYSTEM_INTERNAL_ERROR, "Withdrawal failed.", null, e);
        }
    }

    private String createRecipient(WithdrawalType type, WithdrawalRequest request, String currency, String reference) {
        boolean mobileMoney = type == WithdrawalType.MOBILE_MONEY;
        GatewayResult recipient = paystackClient.createTransferRecipient(
                type,
                request.accountName(),
                mobileMoney ? request.phoneNumber() : request.accountNumber(),
                mobileMoney ? request.mobileMoneyProvider() : request.bankCode(),
                currency);

        if (!recipient.isSuccess() || !StringUtils.hasText(recipient.providerReference())) {
            log.warn("Transfer recipient rejected: reference={}, message={}", reference, recipient.message());
            throw gatewayFailure("Failed to create transfer recipient.", reference, false);
        }
        return recipient.providerReference();
    }

    private void debitAndRecord(String userId, WithdrawalType type, WithdrawalRequest request, String reference,
                                String recipientCode) {
        Wallet wallet = ledgerService.lockByOwner(userId);
        ledgerService.debit(wallet, request.amount(), false);
        Instant now = Instant.now(clock);
        boolean mobileMoney = type == WithdrawalType.MOBILE_MONEY;

        Withdrawal withdrawal = new Withdrawal();
        withdrawal.setReference(reference);
        withdrawal.setUserId(userId);
        withdrawal.setWalletId(wallet.getWalletId());
        withdrawal.setAmount(request.amount());
        withdrawal.setCurrency(wallet.getCurrency());
        withdrawal.setType(type);
        withdrawal.setAccountName(request.accountName());
        if (mobileMoney) {
            withdrawal.setMobileMoneyProvider(request.mobileMoneyProvider());
            withdrawal.setPhoneNumber(request.phoneNumber());
        } else {
            withdrawal.setBankCode(request.bankCode());
            withdrawal.setAccountNumber(request.accountNumber());
        }
        withdrawal.setRecipientCode(recipientCode);
        withdrawal.setStatus(TransactionStatus.PENDING);
        withdrawal.setCreatedAt(now);
        withdrawalRepository.save(withdrawal);
        stateService.recordCreation(withdrawal);

        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setTransactionId(reference);
        receipt.setOwnerId(userId);
        receipt.setType(ReceiptType.WITHDRAWAL);
        receipt.setSenderWalletId(wallet.getWalletId());
        receipt.setReceiverName(request.accountName());
        receipt.setAmount(request.amount());
        receipt.setCurrency(wallet.getCurrency());
        receipt.setReference(reference);
        receipt.setDescription((mobileMoney ? "Withdrawal to Mobile Money" : "Withdrawal to Bank")
                + " - " + request.accountName());
        receipt.setMethod(type.value());
        receipt.setStatus(TransactionStatus.PENDING);
        receipt.setCreatedAt(now);
        receiptRepository.save(receipt);
        stateService.recordCreation(receipt);

        log.info("Withdrawal debited: reference={}, walletId={}, amount={}, currency={}, type={}",
                reference, wallet.getWalletId(), request.amount(), wallet.getCurrency(), type.value());
    }

    private WithdrawalResponse requestTransfer(String reference, String recipientCode, BigDecimal amount) {
        GatewayResult requested;
        try {
            requested = paystackClient.initiateTransfer(amount, recipientCode, reference,
                    "Wallet withdrawal - " + reference);
        } catch (WalletException e) {
            log.warn("Transfer request failed, checking payout status: reference={}, error={}",
                    reference, e.getMessage());
            requested = statusAfterFailedRequest(reference);
        }
        GatewayResult transfer = requested;

        if (transfer.isFailed()) {
            transactionTemplate.executeWithoutResult(status ->
                    refundAndFail(lockWithdrawal(reference), "Transfer initiation failed"));
            throw gatewayFailure("Transfer initiation failed.", reference, true);
        }

        if (transfer.status() == GatewayStatus.OTP_REQUIRED) {
            Withdrawal withdrawal = stateService.updateState(() -> lockWithdrawal(reference),
                    TransactionStatus.PENDING_OTP, w -> w.setTransferCode(transfer.providerReference()));
            log.info("Withdrawal awaiting OTP: reference={}", reference);
            return new WithdrawalResponse(reference, withdrawal.getStatus(), true, transfer.providerReference(),
                    "OTP verification required", null);
        }

        if (StringUtils.hasText(transfer.providerReference())) {
            transactionTemplate.executeWithoutResult(status ->
                    lockWithdrawal(reference).setTransferCode(transfer.providerReference()));
        }
        log.info("Withdrawal initiated: reference={}, gatewayStatus={}", reference, transfer.providerStatus());
        return new WithdrawalResponse(reference, TransactionStatus.PENDING, false, null,
                "Withdrawal initiated successfully", null);
    }

    /**
     * Asks the gateway whether a payout it may not have received exists. Anything other than a payout the gateway
     * holds (including an unreachable gateway) is reported as failed, so the caller refunds.
     */
    private GatewayResult statusAfterFailedRequest(String reference) {
        GatewayResult status = null;
        try {
            status = paystackClient.verifyTransfer(reference);
        } catch (WalletException e) {
            log.warn("Payout status unavailable: reference={}, error={}", reference, e.getMessage());
        }
        if (status != null && (status.status() == GatewayStatus.SUCCESS || status.status() == GatewayStatus.PENDING
                || status.status() == GatewayStatus.OTP_REQUIRED)) {
            log.info("Gateway holds the payout despite the failed request: reference={}, gatewayStatus={}",
                    reference, status.providerStatus());
            return status;
        }
        return new GatewayResult("paystack", GatewayStatus.FAILED, status != null ? status.providerStatus() : null,
                null, "Transfer request failed", JsonNodeFactory.instance.objectNode());
    }

    private FinalizeTransferResponse executeFinalize(String userId, FinalizeTransferRequest request) {
        Withdrawal withdrawal = withdrawalRepository.findByTransferCodeAndUserId(request.transferCode(), userId)
                .orElseThrow(() -> WalletException.of(ErrorCode.TXN_NOT_FOUND, "Withdrawal not found."));
        String reference = withdrawal.getReference();
        stateMachine.validateTransition(withdrawal.getStatus(), TransactionStatus.PROCESSING, reference);

        GatewayResult result = paystackClient.finalizeTransfer(request.transferCode(), request.otp());
        if (result.isFailed()) {
            auditLogService.failure(userId, FINALIZE_OPERATION, withdrawal.getAmount(), withdrawal.getCurrency(),
                    Map.of("reference", reference), result.message());
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED,
                    StringUtils.hasText(result.message()) ? result.message() : "OTP verification failed.",
                    Map.of("reference", reference));
        }

        Withdrawal updated = stateService.updateState(() -> lockWithdrawal(reference), TransactionStatus.PROCESSING,
                w -> w.setOtpVerifiedAt(Instant.now(clock)));

        auditLogService.success(userId, FINALIZE_OPERATION, withdrawal.getAmount(), withdrawal.getCurrency(),
                Map.of("reference", reference));
        return new FinalizeTransferResponse(reference, updated.getStatus(), null);
    }

    private void refundAndFail(Withdrawal withdrawal, String failureReason) {
        String reason = failureReason.length() > 255 ? failureReason.substring(0, 255) : failureReason;
        Instant now = Instant.now(clock);
        if (!withdrawal.isRefunded()) {
            ledgerService.refundOwner(withdrawal.getUserId(), withdrawal.getAmount());
            withdrawal.setRefunded(true);
        }
        if (withdrawal.getStatus() != TransactionStatus.FAILED) {
            stateService.transition(withdrawal, TransactionStatus.FAILED);
        }
        withdrawal.setFailureReason(reason);
        withdrawal.setFailedAt(now);

        receiptRepository.getOneForUpdate(withdrawal.getReference(), withdrawal.getUserId()).ifPresent(receipt -> {
            if (receipt.getStatus() != TransactionStatus.FAILED) {
                stateService.transition(receipt, TransactionStatus.FAILED);
            }
            receipt.setFailureReason(reason);
        });

        log.info("Withdrawal failed and refunded: reference={}, amount={}, reason={}",
                withdrawal.getReference(), withdrawal.getAmount(), reason);
    }

    private Withdrawal lockWithdrawal(String reference) {
        return withdrawalRepository.getOneForUpdate(reference)
                .orElseThrow(() -> WalletException.of(ErrorCode.TXN_NOT_FOUND, "Withdrawal not found.",
                        Map.of("reference", reference)));
    }

    private static void requireDestination(WithdrawalType type, WithdrawalRequest request) {
        if (type == WithdrawalType.MOBILE_MONEY) {
            if (!StringUtils.hasText(request.mobileMoneyProvider()) || !StringUtils.hasText(request.phoneNumber())) {
                throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED,
                        "Provider and phone number are required.");
            }
        } else if (!StringUtils.hasText(request.bankCode()) || !StringUtils.hasText(request.accountNumber())) {
            throw WalletException.of(ErrorCode.SYSTEM_VALIDATION_FAILED, "Account number and bank code required.");
        }
    }

    private static WalletException gatewayFailure(String message, String reference, boolean refunded) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reference", reference);
        if (refunded) {
            details.put("refunded", true);
        }
        details.put("retryable", true);
        return WalletException.of(ErrorCode.SERVICE_PAYSTACK_ERROR, message, details);
    }
}
