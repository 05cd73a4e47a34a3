package com.qrwallet.model;

import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.api.model.WithdrawalType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payout from a wallet to a bank account or mobile-money number through the card/bank gateway.
 *
 * <p>The wallet is debited when the record is created ({@code pending}). If the payout fails the amount is
 * credited back and {@code refunded} is set; {@code refunded} is checked before every refund so that repeated
 * failure notifications cannot credit twice.
 */
@Entity
@Table(name = "withdrawals")
@Getter
@Setter
@NoArgsConstructor
public class Withdrawal implements StatefulRecord {

    @Id
    @Column(length = 64)
    private String reference;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "wallet_id", nullable = false)
    private String walletId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WithdrawalType type;

    @Column(name = "bank_code")
    private String bankCode;

    @Column(name = "mobile_money_provider")
    private String mobileMoneyProvider;

    @Column(name = "account_number")
    private String accountNumber;

    @Column(name = "phone_number")
    private String phoneNumber;

    @Column(name = "account_name")
    private String accountName;

    @Column(name = "recipient_code")
    private String recipientCode;

    @Column(name = "transfer_code")
    private String transferCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 16)
    private TransactionStatus previousStatus;

    @Column(name = "status_updated_at")
    private Instant statusUpdatedAt;

    @Column(nullable = false)
    private boolean refunded;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "otp_verified_at")
    private Instant otpVerifiedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Override
    public String recordType() {
        return "withdrawal";
    }

    @Override
    public String recordId() {
        return reference;
    }
}
