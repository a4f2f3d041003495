package com.flagship.pool_ledger.pool;

import lombok.Value;

/**
 * Operator identity, proposed successor and fee.
 *
 * Immutable: every change produces a new instance.
 */
@Value
public class OperatorState {

    public static final int MAX_FEE_BPS = 2000;
    public static final int BPS_DENOMINATOR = 10_000;

    Address operator;
    Address pendingOperator;
    int feeBps;

    public static OperatorState initial(Address operator, int feeBps) {
        if (operator == null || operator.isZero()) {
            throw new PoolException(PoolErrorCode.INVALID_ADDRESS, "Operator must be a non-zero address");
        }
        checkFee(feeBps);
        return new OperatorState(operator, Address.ZERO, feeBps);
    }

    public boolean isOperator(Address caller) {
        return operator.equals(caller);
    }

    public boolean hasPendingOperator() {
        return !pendingOperator.isZero();
    }

    public OperatorState withFee(int newFeeBps) {
        checkFee(newFeeBps);
        return new OperatorState(operator, pendingOperator, newFeeBps);
    }

    public OperatorState withProposal(Address candidate) {
        return new OperatorState(operator, candidate == null ? Address.ZERO : candidate, feeBps);
    }

    public OperatorState accepted() {
        if (!hasPendingOperator()) {
            throw new IllegalStateException("No operator proposal to accept");
        }
        return new OperatorState(pendingOperator, Address.ZERO, feeBps);
    }

    static void checkFee(int feeBps) {
        if (feeBps < 0 || feeBps > MAX_FEE_BPS) {
            throw new PoolException(PoolErrorCode.FEE_TOO_HIGH,
                String.format("Fee must be within [0, %d] bps, got %d", MAX_FEE_BPS, feeBps));
        }
    }
}
