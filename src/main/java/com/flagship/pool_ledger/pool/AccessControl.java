package com.flagship.pool_ledger.pool;

/**
 * Operator role, two-step operator handoff, fee bound and the pause gate.
 *
 * The pause gate guards deposits and work submission only. Nothing here is consulted by
 * the withdrawal paths.
 */
public class AccessControl {

    public void requireOperator(PoolState state, Address caller) {
        if (!state.getOperatorState().isOperator(caller)) {
            throw new PoolException(PoolErrorCode.NOT_OPERATOR, caller + " is not the operator");
        }
    }

    public void requireNotPaused(PoolState state) {
        if (state.isPaused()) {
            throw new PoolException(PoolErrorCode.PAUSED, "Pool is paused");
        }
    }

    /**
     * @return the previous fee in basis points
     */
    public int setFee(PoolState state, Address caller, int feeBps) {
        requireOperator(state, caller);
        OperatorState current = state.getOperatorState();
        state.setOperatorState(current.withFee(feeBps));
        return current.getFeeBps();
    }

    /**
     * Names {@code candidate} as successor. A zero candidate withdraws the proposal.
     */
    public void proposeOperator(PoolState state, Address caller, Address candidate) {
        requireOperator(state, caller);
        state.setOperatorState(state.getOperatorState().withProposal(candidate));
    }

    /**
     * Completes the handoff. Only the proposed identity may call this.
     *
     * @return the previous operator
     */
    public Address acceptOperator(PoolState state, Address caller) {
        OperatorState current = state.getOperatorState();
        if (!current.hasPendingOperator() || !current.getPendingOperator().equals(caller)) {
            throw new PoolException(PoolErrorCode.NOT_PENDING_OPERATOR, caller + " is not the proposed operator");
        }
        state.setOperatorState(current.accepted());
        return current.getOperator();
    }

    public void setPaused(PoolState state, Address caller, boolean paused) {
        requireOperator(state, caller);
        state.setPaused(paused);
    }
}
