package com.qrwallet.service;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.ReceiptType;
import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.api.request.SendMoneyRequest;
import com.qrwallet.api.response.SendMoneyResponse;
import com.qrwallet.api.response.TransactionReceiptResponse;
import com.qrwallet.config.WalletProperties;
import com.qrwallet.error.WalletException;
import com.qrwallet.mapper.ReceiptMapper;
import com.qrwallet.model.TransactionReceipt;
import com.qrwallet.model.UserAccount;
import com.qrwallet.model.Wallet;
import com.qrwallet.repository.TransactionReceiptRepository;
import com.qrwallet.repository.UserAccountRepository;
import com.qrwallet.repository.WalletRepository;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Peer-to-peer transfers between wallets and the caller's transaction history.
 *
 * <p>A transfer debits amount plus fee from the sender, credits the (possibly converted) amount to the
 * recipient, books the fee on the platform wallet and writes one receipt per party, all in one transaction.
 */
@Service
@Validated
@Slf4j
public class TransferService {

    static final String OPERATION = "sendMoney";
    private static final int DEFAULT_HISTORY_LIMIT = 50;
    private static final int MAX_HISTORY_LIMIT = 200;

    private final KycService kycService;
    private final RateLimitService rateLimitService;
    private final IdempotencyService idempotencyService;
    private final WalletLedgerService ledgerService;
    private final ExchangeRateService exchangeRateService;
    private final PlatformFeeService platformFeeService;
    private final FeeCalculator feeCalculator;
    private final TransactionStateService stateService;
    private final AuditLogService auditLogService;
    private final ReferenceGenerator referenceGenerator;
    private final WalletRepository walletRepository;
    private final UserAccountRepository userAccountRepository;
    private final TransactionReceiptRepository receiptRepository;
    private final WalletProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public TransferService(KycService kycService,
                           RateLimitService rateLimitService,
                           IdempotencyService idempotencyService,
                           WalletLedgerService ledgerService,
                           ExchangeRateService exchangeRateService,
                           PlatformFeeService platformFeeService,
                           FeeCalculator feeCalculator,
                           TransactionStateService stateService,
                           AuditLogService auditLogService,
                           ReferenceGenerator referenceGenerator,
                           WalletRepository walletRepository,
                           UserAccountRepository userAccountRepository,
                           TransactionReceiptRepository receiptRepository,
                           WalletProperties properties,
                           Clock clock,
                           PlatformTransactionManager transactionManager) {
        this.kycService = kycService;
        this.rateLimitService = rateLimitService;
        this.idempotencyService = idempotencyService;
        this.ledgerService = ledgerService;
        this.exchangeRateService = exchangeRateService;
        this.platformFeeService = platformFeeService;
        this.feeCalculator = feeCalculator;
        this.stateService = stateService;
        this.auditLogService = auditLogService;
        this.referenceGenerator = referenceGenerator;
        this.walletRepository = walletRepository;
        this.userAccountRepository = userAccountRepository;
        this.receiptRepository = receiptRepository;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Sends money from the caller's wallet to another wallet.
     *
     * @param userId  Authenticated sender
     * @param request Recipient, amount, note and idempotency key
     * @return Transfer result; a replay of a completed key returns the original result flagged as replayed
     * @throws WalletException KYC_REQUIRED, RATE_LIMIT_EXCEEDED, TXN_RECIPIENT_NOT_FOUND, TXN_AMOUNT_INVALID,
     *                         TXN_AMOUNT_TOO_LARGE, TXN_SELF_TRANSFER, WALLET_INSUFFICIENT_FUNDS, ...
     */
    public SendMoneyResponse sendMoney(String userId, @Valid SendMoneyRequest request) {
        kycService.enforceKyc(userId);
        rateLimitService.enforceRateLimit(userId, OPERATION);

        if (request.recipientWalletId() == null || request.recipientWalletId().isBlank()) {
            throw WalletException.of(ErrorCode.TXN_RECIPIENT_NOT_FOUND, "Invalid recipient wallet ID.");
        }
        BigDecimal amount = request.amount();
        if (amount == null || amount.signum() <= 0) {
            throw WalletException.of(ErrorCode.TXN_AMOUNT_INVALID, "Amount must be positive.");
        }
        if (amount.compareTo(properties.getTransfer().getMaxAmount()) > 0) {
            throw WalletException.of(ErrorCode.TXN_AMOUNT_TOO_LARGE, null,
                    Map.of("maxAmount", properties.getTransfer().getMaxAmount()));
        }

        return idempotencyService.withIdempotency(request.idempotencyKey(), OPERATION, userId,
                SendMoneyResponse.class, () -> executeTransfer(userId, request));
    }

    /**
     * The caller's receipts, newest first.
     *
     * @param limit Maximum number of entries; defaults to 50, capped at 200
     */
    public List<TransactionReceiptResponse> listTransactions(String userId, Integer limit) {
        kycService.enforceKyc(userId);
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_HISTORY_LIMIT : Math.min(limit, MAX_HISTORY_LIMIT);
        List<TransactionReceipt> receipts =
                receiptRepository.findByOwnerIdOrderByCreatedAtDesc(userId, PageRequest.of(0, effectiveLimit));
        return ReceiptMapper.INSTANCE.toResponses(receipts);
    }

    private SendMoneyResponse executeTransfer(String userId, SendMoneyRequest request) {
        BigDecimal amount = request.amount();
        try {
            SendMoneyResponse response = transactionTemplate.execute(status -> transfer(userId, request));

            auditLogService.success(userId, OPERATION, amount, response.currency(), Map.of(
                    "transactionId", response.transactionId(),
                    "recipientWalletId", request.recipientWalletId(),
                    "fee", response.fee()));
            return response;
        } catch (WalletException e) {
            auditLogService.failure(userId, OPERATION, amount, null,
                    Map.of("recipientWalletId", request.recipientWalletId()), e.getCode() + ": " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Transfer failed: userId={}, recipientWalletId={}, amount={}",
                    userId, request.recipientWalletId(), amount, e);
            auditLogService.failure(userId, OPERATION, amount, null,
                    Map.of("recipientWalletId", request.recipientWalletId()), e.getMessage());
            throw new WalletException(ErrorCode.SYSTEM_INTERNAL_ERROR, "Transaction failed.", null, e);
        }
    }

    private SendMoneyResponse transfer(String userId, SendMoneyRequest request) {
        BigDecimal amount = request.amount();

        Wallet recipientRef = walletRepository.findByWalletId(request.recipientWalletId())
                .orElseThrow(() -> WalletException.of(ErrorCode.TXN_RECIPIENT_NOT_FOUND, "Invalid recipient wallet ID.",
                        Map.of("recipientWalletId", request.recipientWalletId())));
        Wallet senderRef = walletRepository.findByOwnerId(userId)
                .orElseThrow(() -> WalletException.of(ErrorCode.WALLET_NOT_FOUND));

        if (senderRef.getId().equals(recipientRef.getId())) {
            throw WalletException.of(ErrorCode.TXN_SELF_TRANSFER);
        }

        // lock in primary key order so opposite transfers cannot deadlock
        Wallet sender;
        Wallet recipient;
        if (senderRef.getId() < recipientRef.getId()) {
            sender = ledgerService.lockById(senderRef.getId());
            recipient = ledgerService.lockById(recipientRef.getId());
        } else {
            recipient = ledgerService.lockById(recipientRef.getId());
            sender = ledgerService.lockById(senderRef.getId());
        }

        ledgerService.requireTransferable(recipient);

        BigDecimal fee = feeCalculator.fee(amount);
        BigDecimal total = amount.add(fee);
        ExchangeRateService.Conversion conversion =
                exchangeRateService.convert(amount, sender.getCurrency(), recipient.getCurrency());

        ledgerService.debit(sender, total, true);
        ledgerService.credit(recipient, conversion.amount());

        String senderName = displayName(userId);
        String recipientName = displayName(recipient.getOwnerId());
        String transactionId = referenceGenerator.transferId();
        String reference = referenceGenerator.receiptReference();
        Instant now = Instant.now(clock);

        platformFeeService.recordFee(transactionId, fee, sender.getCurrency(), userId, senderName, amount);

        TransactionReceipt sent = receipt(transactionId, userId, ReceiptType.SEND, sender, recipient,
                senderName, recipientName, amount, fee, conversion, request.note(), reference, now);
        TransactionReceipt received = receipt(transactionId, recipient.getOwnerId(), ReceiptType.RECEIVE, sender,
                recipient, senderName, recipientName, amount, BigDecimal.ZERO, conversion, request.note(), reference, now);
        receiptRepository.save(sent);
        receiptRepository.save(received);
        stateService.recordCreation(sent);
        stateService.recordCreation(received);

        log.info("Transfer completed: transactionId={}, senderWalletId={}, recipientWalletId={}, amount={}, fee={}, currency={}",
                transactionId, sender.getWalletId(), recipient.getWalletId(), amount, fee, sender.getCurrency());

        return new SendMoneyResponse(transactionId, amount, fee, sender.getCurrency(), recipientName,
                sender.getBalance(), null);
    }

    private TransactionReceipt receipt(String transactionId, String ownerId, ReceiptType type, Wallet sender,
                                       Wallet recipient, String senderName, String recipientName, BigDecimal amount,
                                       BigDecimal fee, ExchangeRateService.Conversion conversion, String note,
                                       String reference, Instant now) {
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setTransactionId(transactionId);
        receipt.setOwnerId(ownerId);
        receipt.setType(type);
        receipt.setSenderWalletId(sender.getWalletId());
        receipt.setReceiverWalletId(recipient.getWalletId());
        receipt.setSenderName(senderName);
        receipt.setReceiverName(recipientName);
        receipt.setAmount(amount);
        receipt.setFee(fee);
        receipt.setCurrency(sender.getCurrency());
        receipt.setReceiverCurrency(recipient.getCurrency());
        receipt.setExchangeRate(conversion.rate());
        receipt.setConvertedAmount(conversion.converted() ? conversion.amount() : null);
        receipt.setNote(note);
        receipt.setReference(reference);
        receipt.setStatus(TransactionStatus.COMPLETED);
        receipt.setCreatedAt(now);
        receipt.setCompletedAt(now);
        return receipt;
    }

    private String displayName(String userId) {
        return userAccountRepository.findById(userId)
                .map(UserAccount::getFullName)
                .filter(name -> !name.isBlank())
                .orElse("Unknown");
    }
}
