package com.flagship.pool_ledger.pool.event;

import java.util.List;

/**
 * Receives the events of a successful operation as the last step of its atomic unit.
 * A sink that throws rolls the operation back.
 */
@FunctionalInterface
public interface PoolEventSink {

    PoolEventSink NONE = events -> { };

    void accept(List<PoolEvent> events);
}
