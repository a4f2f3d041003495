package com.flagship.pool_ledger.external;

import java.util.List;

/**
 * Remote system that accepts the operator's work and pays for it.
 *
 * The amount paid by {@link #claim(List)} is not returned; the pool observes it only as
 * the change of its own asset balance across the call.
 */
public interface WorkSettlementChannel {

    /**
     * Forwards an opaque work payload.
     *
     * @return {@code true} if the remote side accepted it
     */
    boolean submit(byte[] payload);

    /**
     * Requests settlement of the given epochs, paying into the pool's balance.
     *
     * @return {@code true} if the claim went through
     */
    boolean claim(List<Long> epochIds);
}
