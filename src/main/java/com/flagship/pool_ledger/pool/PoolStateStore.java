package com.flagship.pool_ledger.pool;

import com.flagship.pool_ledger.pool.event.PoolEvent;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of the pool state.
 *
 * The engine loads the state once at construction and commits each operation's changes
 * together with its events before the operation returns. A commit that throws rolls the
 * operation back in memory.
 */
public interface PoolStateStore {

    PoolStateStore NONE = new PoolStateStore() {
        @Override
        public Optional<PoolState> load() {
            return Optional.empty();
        }

        @Override
        public void commit(PoolStateDelta delta, List<PoolEvent> events) {
        }
    };

    /**
     * @return the stored state, or empty if nothing has been committed yet
     */
    Optional<PoolState> load();

    void commit(PoolStateDelta delta, List<PoolEvent> events);
}
