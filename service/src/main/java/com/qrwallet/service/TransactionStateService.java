package com.qrwallet.service;

import com.qrwallet.api.model.TransactionStatus;
import com.qrwallet.model.StatefulRecord;
import com.qrwallet.model.StatusTransition;
import com.qrwallet.repository.StatusTransitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Applies state machine transitions to persistent records and keeps their status history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionStateService {

    private final TransactionStateMachine stateMachine;
    private final StatusTransitionRepository statusTransitionRepository;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    /**
     * Moves an already locked record to {@code toStatus} inside the caller's transaction and appends the
     * history entry. The record itself is flushed with the surrounding transaction.
     *
     * @throws com.qrwallet.error.WalletException TXN_INVALID_STATE if the transition is not allowed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StateTransition transition(StatefulRecord record, TransactionStatus toStatus) {
        StateTransition transition = stateMachine.buildTransition(record, toStatus);
        transition.applyTo(record);
        statusTransitionRepository.save(transition.toHistoryEntry());

        log.info("State transition: recordType={}, recordId={}, from={}, to={}",
                transition.recordType(), transition.recordId(), transition.from(), transition.to());
        return transition;
    }

    /**
     * Records the initial status of a newly created record as a history entry without a {@code from} state.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordCreation(StatefulRecord record) {
        Instant now = Instant.now(clock);
        record.setStatusUpdatedAt(now);
        statusTransitionRepository.save(
                new StatusTransition(null, record.recordType(), record.recordId(), null, record.getStatus(), now));
    }

    /**
     * Loads and locks a record, transitions it and applies extra field updates, all in one new transaction.
     *
     * @param lockedLoader Loads the record with a pessimistic lock; must throw if it does not exist
     * @param toStatus     Target status
     * @param extraUpdates Additional field changes applied after the status change
     * @return The updated record
     */
    public <T extends StatefulRecord> T updateState(Supplier<T> lockedLoader, TransactionStatus toStatus,
                                                    Consumer<T> extraUpdates) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        return template.execute(status -> {
            T record = lockedLoader.get();
            transition(record, toStatus);
            if (extraUpdates != null) {
                extraUpdates.accept(record);
            }
            return record;
        });
    }
}
