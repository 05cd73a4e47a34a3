package com.qrwallet.model;

import com.qrwallet.api.model.KycStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * User profile as far as the wallet backend needs it: display data and KYC state.
 *
 * <p>{@code kycStatus} is authoritative. The legacy {@code kycCompleted}/{@code kycVerified} pair predates it
 * and is only consulted while {@code kycStatus} is unset.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
public class UserAccount {

    @Id
    private String id;

    @Column(name = "full_name")
    private String fullName;

    private String email;

    @Column(name = "profile_photo_url")
    private String profilePhotoUrl;

    /**
     * Null means unset.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "kyc_status", length = 16)
    private KycStatus kycStatus;

    @Column(name = "kyc_completed")
    private Boolean kycCompleted;

    @Column(name = "kyc_verified")
    private Boolean kycVerified;

    /**
     * Review status of the uploaded KYC documents as reported by the identity provider
     * ({@code submitted}, {@code approved}, {@code verified}, {@code rejected}); null if nothing was uploaded.
     */
    @Column(name = "kyc_documents_status", length = 32)
    private String kycDocumentsStatus;

    @Column(name = "kyc_status_updated_at")
    private Instant kycStatusUpdatedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
