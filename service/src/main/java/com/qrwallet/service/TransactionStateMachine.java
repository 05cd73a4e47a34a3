package com.qrwallet.service;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.error.WalletException;
import com.qrwallet.model.StatefulRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State machine for withdrawals, mobile-money transactions and receipts.
 *
 * <p>Transitions:
 * <pre>
 * created      → pending, completed, cancelled
 * pending      → processing, pending_otp, completed, failed, cancelled
 * pending_otp  → processing, failed, cancelled
 * processing   → completed, failed
 * completed    → refunded
 * failed       → refunded, pending
 * </pre>
 *
 * <p>refunded and cancelled are terminal. A transition to the same state is rejected.
 */
@Component
@RequiredArgsConstructor
public class TransactionStateMachine {

    /**
     * Map of allowed transitions: fromStatus → Set of valid toStatus values.
     */
    private static final Map<TransactionStatus, Set<TransactionStatus>> ALLOWED_TRANSITIONS = Map.of(
            TransactionStatus.CREATED, EnumSet.of(
                    TransactionStatus.PENDING,
                    TransactionStatus.COMPLETED,
                    TransactionStatus.CANCELLED
            ),
            TransactionStatus.PENDING, EnumSet.of(
                    TransactionStatus.PROCESSING,
                    TransactionStatus.PENDING_OTP,
                    TransactionStatus.COMPLETED,
                    TransactionStatus.FAILED,
                    TransactionStatus.CANCELLED
            ),
            TransactionStatus.PENDING_OTP, EnumSet.of(
                    TransactionStatus.PROCESSING,
                    TransactionStatus.FAILED,
                    TransactionStatus.CANCELLED
            ),
            TransactionStatus.PROCESSING, EnumSet.of(
                    TransactionStatus.COMPLETED,
                    TransactionStatus.FAILED
            ),
            TransactionStatus.COMPLETED, EnumSet.of(
                    TransactionStatus.REFUNDED
            ),
            // failed → pending is a retry
            TransactionStatus.FAILED, EnumSet.of(
                    TransactionStatus.REFUNDED,
                    TransactionStatus.PENDING
            )
    );

    private static final Set<TransactionStatus> TERMINAL_STATES =
            EnumSet.of(TransactionStatus.REFUNDED, TransactionStatus.CANCELLED);

    private final Clock clock;

    /**
     * Maps a gateway or legacy status string onto a {@link TransactionStatus}.
     * <p>
     * {@code null} is {@code created}; {@code SUCCESSFUL}, {@code SUCCESS} and {@code success} are {@code completed};
     * {@code PENDING} and {@code FAILED} map to their lowercase states; anything else is lower-cased and matched
     * against the known state names.
     * </p>
     *
     * @param externalStatus Status as reported by a gateway or stored by an older version
     * @return The normalised status, or empty when the value names no known state
     */
    public Optional<TransactionStatus> normalize(String externalStatus) {
        if (externalStatus == null) {
            return Optional.of(TransactionStatus.CREATED);
        }
        switch (externalStatus) {
            case "SUCCESSFUL", "SUCCESS", "success":
                return Optional.of(TransactionStatus.COMPLETED);
            case "PENDING":
                return Optional.of(TransactionStatus.PENDING);
            case "FAILED":
                return Optional.of(TransactionStatus.FAILED);
            default:
                String lower = externalStatus.toLowerCase(Locale.ROOT);
                for (TransactionStatus status : TransactionStatus.values()) {
                    if (status.value().equals(lower)) {
                        return Optional.of(status);
                    }
                }
                return Optional.empty();
        }
    }

    /**
     * Validates if a status transition is allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise (including same-state transitions)
     */
    public boolean isTransitionAllowed(TransactionStatus fromStatus, TransactionStatus toStatus) {
        if (fromStatus == null || toStatus == null || fromStatus == toStatus) {
            return false;
        }
        Set<TransactionStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates a status transition, throwing if it is not allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @param documentId Identifier of the record, echoed in the error details
     * @throws WalletException TXN_INVALID_STATE with {@code from}, {@code to} and {@code documentId} details
     */
    public void validateTransition(TransactionStatus fromStatus, TransactionStatus toStatus, String documentId) {
        if (isTransitionAllowed(fromStatus, toStatus)) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", fromStatus == null ? null : fromStatus.value());
        details.put("to", toStatus == null ? null : toStatus.value());
        details.put("documentId", documentId);

        String message;
        if (isFinalState(fromStatus)) {
            message = String.format("Transaction %s is in terminal state: %s.", documentId, fromStatus.value());
        } else if (fromStatus == TransactionStatus.COMPLETED) {
            message = String.format("Completed transaction %s can only be refunded.", documentId);
        } else {
            message = String.format("Invalid state transition: %s → %s.",
                    fromStatus == null ? null : fromStatus.value(),
                    toStatus == null ? null : toStatus.value());
        }
        throw WalletException.of(ErrorCode.TXN_INVALID_STATE, message, details);
    }

    /**
     * Checks if a status is a final state (no further transitions allowed).
     */
    public boolean isFinalState(TransactionStatus status) {
        return status != null && TERMINAL_STATES.contains(status);
    }

    /**
     * Gets all allowed target statuses from a given status.
     *
     * @param fromStatus Current status
     * @return Set of allowed target statuses (empty if none allowed)
     */
    public Set<TransactionStatus> getAllowedTransitions(TransactionStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }

    /**
     * Validates the move of {@code record} to {@code toStatus} and returns the fields to write. Nothing is
     * changed until {@link StateTransition#applyTo(StatefulRecord)} is called, so the caller decides which
     * transaction the change belongs to.
     */
    public StateTransition buildTransition(StatefulRecord record, TransactionStatus toStatus) {
        TransactionStatus fromStatus = record.getStatus();
        validateTransition(fromStatus, toStatus, record.recordId());
        return new StateTransition(record.recordType(), record.recordId(), fromStatus, toStatus, Instant.now(clock));
    }
}
