package com.flagship.pool_ledger.store;

import com.flagship.pool_ledger.pool.Address;
import com.flagship.pool_ledger.pool.OperatorState;
import com.flagship.pool_ledger.pool.PoolStateDelta;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The pool-wide row: epoch cursor, operator and pause flag. There is exactly one, with id 1.
 */
@Entity
@Table(name = "pool_state")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PoolStateEntity {

    static final short SINGLETON_ID = 1;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private short id;

    @Column(name = "last_processed_epoch", nullable = false)
    private long lastProcessedEpoch;

    @Column(name = "operator", nullable = false, length = 42)
    private String operator;

    @Column(name = "pending_operator", nullable = false, length = 42)
    private String pendingOperator;

    @Column(name = "fee_bps", nullable = false)
    private int feeBps;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void onWrite() {
        this.updatedAt = Instant.now();
    }

    static PoolStateEntity create() {
        PoolStateEntity entity = new PoolStateEntity();
        entity.id = SINGLETON_ID;
        return entity;
    }

    void updateFrom(PoolStateDelta delta) {
        if (delta.getLastProcessedEpoch() < this.lastProcessedEpoch) {
            throw new IllegalStateException(String.format(
                "Stored epoch cursor cannot move backwards: %d -> %d",
                this.lastProcessedEpoch, delta.getLastProcessedEpoch()));
        }
        OperatorState operatorState = delta.getOperatorState();
        this.lastProcessedEpoch = delta.getLastProcessedEpoch();
        this.operator = operatorState.getOperator().toString();
        this.pendingOperator = operatorState.getPendingOperator().toString();
        this.feeBps = operatorState.getFeeBps();
        this.paused = delta.isPaused();
    }

    public OperatorState toOperatorState() {
        return new OperatorState(Address.of(operator), Address.of(pendingOperator), feeBps);
    }
}
