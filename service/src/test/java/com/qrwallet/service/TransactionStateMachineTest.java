package com.qrwallet.service;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.error.WalletException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Transaction state machine")
class TransactionStateMachineTest {

    private final TransactionStateMachine stateMachine = new TransactionStateMachine(Clock.systemUTC());

    @Test
    void pendingMayMoveToEveryActiveState() {
        assertThat(stateMachine.getAllowedTransitions(TransactionStatus.PENDING)).containsExactlyInAnyOrder(
                TransactionStatus.PROCESSING,
                TransactionStatus.PENDING_OTP,
                TransactionStatus.COMPLETED,
                TransactionStatus.FAILED,
                TransactionStatus.CANCELLED);
    }

    @Test
    void failedMayBeRetriedOrRefunded() {
        assertThat(stateMachine.isTransitionAllowed(TransactionStatus.FAILED, TransactionStatus.PENDING)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(TransactionStatus.FAILED, TransactionStatus.REFUNDED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(TransactionStatus.FAILED, TransactionStatus.COMPLETED)).isFalse();
    }

    @Test
    void sameStateTransitionIsRejected() {
        for (TransactionStatus status : TransactionStatus.values()) {
            assertThat(stateMachine.isTransitionAllowed(status, status)).isFalse();
        }
    }

    @Test
    void terminalStatesHaveNoTargets() {
        assertThat(stateMachine.isFinalState(TransactionStatus.REFUNDED)).isTrue();
        assertThat(stateMachine.isFinalState(TransactionStatus.CANCELLED)).isTrue();
        assertThat(stateMachine.isFinalState(TransactionStatus.COMPLETED)).isFalse();
        assertThat(stateMachine.getAllowedTransitions(TransactionStatus.REFUNDED)).isEmpty();
        assertThat(stateMachine.getAllowedTransitions(TransactionStatus.CANCELLED)).isEmpty();
    }

    @Test
    void terminalStateErrorNamesTheState() {
        assertThatThrownBy(() -> stateMachine.validateTransition(
                TransactionStatus.REFUNDED, TransactionStatus.PENDING, "WD-1"))
                .isInstanceOfSatisfying(WalletException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.TXN_INVALID_STATE);
                    assertThat(e.getMessage()).isEqualTo("Transaction WD-1 is in terminal state: refunded.");
                    assertThat(e.getDetails())
                            .containsEntry("from", "refunded")
                            .containsEntry("to", "pending")
                            .containsEntry("documentId", "WD-1");
                });
    }

    @Test
    void completedCanOnlyBeRefunded() {
        assertThatThrownBy(() -> stateMachine.validateTransition(
                TransactionStatus.COMPLETED, TransactionStatus.FAILED, "WD-2"))
                .isInstanceOf(WalletException.class)
                .hasMessage("Completed transaction WD-2 can only be refunded.");
    }

    @Test
    void otherInvalidTransitionsNameBothStates() {
        assertThatThrownBy(() -> stateMachine.validateTransition(
                TransactionStatus.PROCESSING, TransactionStatus.PENDING, "WD-3"))
                .isInstanceOf(WalletException.class)
                .hasMessage("Invalid state transition: processing → pending.");
    }

    @Test
    void normalizesGatewayStatuses() {
        assertThat(stateMachine.normalize(null)).contains(TransactionStatus.CREATED);
        assertThat(stateMachine.normalize("SUCCESSFUL")).contains(TransactionStatus.COMPLETED);
        assertThat(stateMachine.normalize("success")).contains(TransactionStatus.COMPLETED);
        assertThat(stateMachine.normalize("PENDING")).contains(TransactionStatus.PENDING);
        assertThat(stateMachine.normalize("FAILED")).contains(TransactionStatus.FAILED);
        assertThat(stateMachine.normalize("Pending_OTP")).contains(TransactionStatus.PENDING_OTP);
        assertThat(stateMachine.normalize("REJECTED")).isEmpty();
    }
}
