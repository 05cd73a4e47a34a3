package com.qrwallet.model;

import com.qrwallet.api.model.ReceiptType;
import com.qrwallet.api.model.TransactionStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-user transaction receipt.
 *
 * <p>A peer transfer produces two receipts sharing one {@code transactionId}: a SEND receipt owned by the sender
 * (carrying the fee) and a RECEIVE receipt owned by the recipient (fee zero). Deposits and withdrawals produce one
 * receipt whose {@code reference} points at the payment or withdrawal record.
 */
@Entity
@Table(name = "transaction_receipts",
        uniqueConstraints = @UniqueConstraint(columnNames = {"transaction_id", "owner_id"}))
@Getter
@Setter
@NoArgsConstructor
public class TransactionReceipt implements StatefulRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false, length = 64)
    private String transactionId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ReceiptType type;

    @Column(name = "sender_wallet_id")
    private String senderWalletId;

    @Column(name = "receiver_wallet_id")
    private String receiverWalletId;

    @Column(name = "sender_name")
    private String senderName;

    @Column(name = "receiver_name")
    private String receiverName;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal fee = BigDecimal.ZERO;

    /**
     * Currency of {@code amount} and {@code fee}.
     */
    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "receiver_currency", length = 3)
    private String receiverCurrency;

    /**
     * Units of receiver currency per unit of sender currency; null for same-currency transfers.
     */
    @Column(name = "exchange_rate", precision = 24, scale = 10)
    private BigDecimal exchangeRate;

    @Column(name = "converted_amount", precision = 19, scale = 2)
    private BigDecimal convertedAmount;

    @Column(length = 280)
    private String note;

    private String reference;

    private String description;

    /**
     * Funding rail for deposits and withdrawals (e.g. {@code card}, {@code MTN MoMo}).
     */
    private String method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 16)
    private TransactionStatus previousStatus;

    @Column(name = "status_updated_at")
    private Instant statusUpdatedAt;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Override
    public String recordType() {
        return "receipt";
    }

    @Override
    public String recordId() {
        return transactionId + ":" + ownerId;
    }
}
