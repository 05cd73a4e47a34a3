package com.qrwallet.model;

import com.qrwallet.api.model.MomoProduct;
import com.qrwallet.api.model.TransactionStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Mobile-money collection or disbursement initiated by this service.
 *
 * <p>{@code referenceId} is the UUID sent to the provider as X-Reference-Id and externalId; provider callbacks
 * for unknown reference ids are rejected. {@code walletAmount} is the amount in the wallet's currency: debited at
 * creation for disbursements, credited on success for collections.
 */
@Entity
@Table(name = "momo_transactions")
@Getter
@Setter
@NoArgsConstructor
public class MomoTransaction implements StatefulRecord {

    @Id
    @Column(name = "reference_id", length = 36)
    private String referenceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MomoProduct type;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "wallet_amount", precision = 19, scale = 2)
    private BigDecimal walletAmount;

    @Column(name = "wallet_currency", length = 3)
    private String walletCurrency;

    @Column(name = "phone_number", nullable = false)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 16)
    private TransactionStatus previousStatus;

    @Column(name = "status_updated_at")
    private Instant statusUpdatedAt;

    /**
     * Raw status last reported by the provider (SUCCESSFUL, FAILED, PENDING).
     */
    @Column(name = "provider_status", length = 32)
    private String providerStatus;

    @Column(name = "callback_status", length = 32)
    private String callbackStatus;

    @Column(name = "verified_status", length = 32)
    private String verifiedStatus;

    @Column(name = "financial_transaction_id")
    private String financialTransactionId;

    @Column(nullable = false)
    private boolean refunded;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Override
    public String recordType() {
        return "momo_transaction";
    }

    @Override
    public String recordId() {
        return referenceId;
    }
}
