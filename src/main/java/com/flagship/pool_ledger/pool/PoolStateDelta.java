package com.flagship.pool_ledger.pool;

import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What one committed operation changed, in the shape a store writes it.
 *
 * Participants are upserted by identity; a withdrawal queue listed in
 * {@code changedWithdrawals} replaces the stored queue of that owner, an empty list
 * clearing it. The pool-wide fields are always carried.
 */
@Value
public class PoolStateDelta {
    List<Participant> upsertedParticipants;
    Set<Address> removedParticipants;
    Map<Address, List<PendingWithdrawal>> changedWithdrawals;
    long lastProcessedEpoch;
    OperatorState operatorState;
    boolean paused;

    public static PoolStateDelta between(PoolState before, PoolState after) {
        List<Participant> upserted = new ArrayList<>();
        after.getParticipants().forEach((identity, participant) -> {
            Participant previous = before.getParticipants().get(identity);
            if (previous == null || !previous.sameBalancesAs(participant)) {
                upserted.add(participant.copy());
            }
        });

        Set<Address> removed = new HashSet<>(before.getParticipants().keySet());
        removed.removeAll(after.getParticipants().keySet());

        Set<Address> owners = new HashSet<>(before.getWithdrawals().keySet());
        owners.addAll(after.getWithdrawals().keySet());
        Map<Address, List<PendingWithdrawal>> changed = new LinkedHashMap<>();
        for (Address owner : owners) {
            List<PendingWithdrawal> previous = before.withdrawalsOf(owner);
            List<PendingWithdrawal> current = after.withdrawalsOf(owner);
            if (!previous.equals(current)) {
                changed.put(owner, List.copyOf(current));
            }
        }

        return new PoolStateDelta(List.copyOf(upserted), Set.copyOf(removed), Map.copyOf(changed),
            after.getLastProcessedEpoch(), after.getOperatorState(), after.isPaused());
    }
}
