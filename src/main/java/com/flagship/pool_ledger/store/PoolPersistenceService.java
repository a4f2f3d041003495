package com.flagship.pool_ledger.store;

import com.flagship.pool_ledger.outbox.OutboxService;
import com.flagship.pool_ledger.pool.Address;
import com.flagship.pool_ledger.pool.Participant;
import com.flagship.pool_ledger.pool.PendingWithdrawal;
import com.flagship.pool_ledger.pool.PoolState;
import com.flagship.pool_ledger.pool.PoolStateDelta;
import com.flagship.pool_ledger.pool.PoolStateStore;
import com.flagship.pool_ledger.pool.event.PoolEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Postgres-backed {@link PoolStateStore}.
 *
 * Each commit writes the participant rows, withdrawal queues and pool row an operation
 * changed, and its outbox events, in one transaction. This bridges the engine's state
 * and the JPA entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolPersistenceService implements PoolStateStore {

    private final PoolStateRepository poolStateRepository;
    private final ParticipantRepository participantRepository;
    private final PendingWithdrawalRepository withdrawalRepository;
    private final OutboxService outboxService;

    @Override
    @Transactional(readOnly = true)
    public Optional<PoolState> load() {
        return poolStateRepository.findById(PoolStateEntity.SINGLETON_ID).map(pool -> {
            List<Participant> participants = participantRepository.findAll().stream()
                .map(ParticipantEntity::toDomain)
                .toList();

            Map<Address, List<PendingWithdrawal>> withdrawals = new LinkedHashMap<>();
            for (PendingWithdrawalEntity row : withdrawalRepository.findAllByOrderByOwnerAscPositionAsc()) {
                PendingWithdrawal withdrawal = row.toDomain();
                withdrawals.computeIfAbsent(withdrawal.getOwner(), owner -> new ArrayList<>()).add(withdrawal);
            }

            log.debug("Loaded pool state: epoch={}, participants={}, withdrawal queues={}",
                pool.getLastProcessedEpoch(), participants.size(), withdrawals.size());
            return PoolState.restore(pool.toOperatorState(), pool.getLastProcessedEpoch(), pool.isPaused(),
                participants, withdrawals);
        });
    }

    @Override
    @Transactional
    public void commit(PoolStateDelta delta, List<PoolEvent> events) {
        PoolStateEntity pool = poolStateRepository.findById(PoolStateEntity.SINGLETON_ID)
            .orElseGet(PoolStateEntity::create);
        pool.updateFrom(delta);
        poolStateRepository.save(pool);

        for (Participant participant : delta.getUpsertedParticipants()) {
            ParticipantEntity entity = participantRepository.findById(participant.getIdentity().toString())
                .map(existing -> {
                    existing.updateFromDomain(participant);
                    return existing;
                })
                .orElseGet(() -> ParticipantEntity.fromDomain(participant));
            participantRepository.save(entity);
        }
        for (Address removed : delta.getRemovedParticipants()) {
            participantRepository.deleteById(removed.toString());
        }

        delta.getChangedWithdrawals().forEach((owner, queue) -> {
            withdrawalRepository.deleteByOwner(owner.toString());
            for (int position = 0; position < queue.size(); position++) {
                withdrawalRepository.save(PendingWithdrawalEntity.fromDomain(queue.get(position), position));
            }
        });

        outboxService.saveEvents(events);

        log.debug("Committed pool state: epoch={}, participants upserted={}, removed={}, queues={}, events={}",
            delta.getLastProcessedEpoch(), delta.getUpsertedParticipants().size(),
            delta.getRemovedParticipants().size(), delta.getChangedWithdrawals().size(), events.size());
    }
}
