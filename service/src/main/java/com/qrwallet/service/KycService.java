package com.qrwallet.service;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.KycStatus;
import com.qrwallet.api.response.KycStatusResponse;
import com.qrwallet.error.WalletException;
import com.qrwallet.model.UserAccount;
import com.qrwallet.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Identity verification gate in front of every operation that moves money or reveals financial state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KycService {

    private static final Set<String> APPROVED_DOCUMENT_STATUSES = Set.of("approved", "verified");

    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    /**
     * Allows the call if the user is verified.
     * <p>
     * Users verified before {@code kycStatus} existed carry only the legacy {@code kycCompleted}/{@code kycVerified}
     * flags; they are migrated to {@code verified} on first use.
     * </p>
     *
     * @throws WalletException WALLET_NOT_FOUND if the user does not exist, KYC_REQUIRED if not verified
     */
    @Transactional
    public void enforceKyc(String userId) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> WalletException.of(ErrorCode.WALLET_NOT_FOUND, "User account not found."));

        if (user.getKycStatus() == KycStatus.VERIFIED) {
            return;
        }

        if (user.getKycStatus() == null
                && Boolean.TRUE.equals(user.getKycCompleted())
                && Boolean.TRUE.equals(user.getKycVerified())) {
            user.setKycStatus(KycStatus.VERIFIED);
            user.setKycStatusUpdatedAt(Instant.now(clock));
            log.info("Migrated legacy KYC flags to kycStatus=verified: userId={}", userId);
            return;
        }

        throw WalletException.of(ErrorCode.KYC_REQUIRED, null,
                Map.of("kycStatus", user.getKycStatus() == null ? "unset" : user.getKycStatus().value()));
    }

    /**
     * Sets the caller's KYC status. {@code verified} is only accepted once the identity provider has approved the
     * uploaded documents.
     *
     * @throws WalletException KYC_VERIFICATION_FAILED for an unknown status, KYC_INCOMPLETE when documents are
     *                         missing or not approved
     */
    @Transactional
    public KycStatusResponse updateKycStatus(String userId, String requestedStatus) {
        KycStatus status = KycStatus.fromValue(requestedStatus);
        if (status == null) {
            throw WalletException.of(ErrorCode.KYC_VERIFICATION_FAILED, "Invalid KYC status.");
        }

        UserAccount user = userAccountRepository.getOneForUpdate(userId)
                .orElseThrow(() -> WalletException.of(ErrorCode.WALLET_NOT_FOUND, "User account not found."));

        if (status == KycStatus.VERIFIED) {
            String documentsStatus = user.getKycDocumentsStatus();
            if (documentsStatus == null) {
                throw WalletException.of(ErrorCode.KYC_INCOMPLETE, "No KYC documents found.");
            }
            if (!APPROVED_DOCUMENT_STATUSES.contains(documentsStatus)) {
                throw WalletException.of(ErrorCode.KYC_INCOMPLETE, "KYC documents have not been approved.",
                        Map.of("documentsStatus", documentsStatus));
            }
            user.setKycCompleted(true);
            user.setKycVerified(true);
        }

        user.setKycStatus(status);
        user.setKycStatusUpdatedAt(Instant.now(clock));
        log.info("KYC status updated: userId={}, kycStatus={}", userId, status.value());
        return new KycStatusResponse(status);
    }
}
