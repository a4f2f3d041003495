package com.flagship.pool_ledger.store;

import com.flagship.pool_ledger.pool.Address;
import com.flagship.pool_ledger.pool.Participant;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for a participant's balances.
 *
 * No setters: rows are created by {@link #fromDomain(Participant)} and changed only
 * through {@link #updateFromDomain(Participant)}.
 */
@Entity
@Table(name = "participants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ParticipantEntity {

    @Id
    @Column(name = "identity", nullable = false, updatable = false, length = 42)
    private String identity;

    @Column(name = "pending_amount", nullable = false, precision = 78, scale = 0)
    private BigDecimal pendingAmount;

    @Column(name = "locked_amount", nullable = false, precision = 78, scale = 0)
    private BigDecimal lockedAmount;

    @Column(name = "lock_epoch", nullable = false)
    private long lockEpoch;

    @Column(name = "roster_index", nullable = false)
    private int rosterIndex;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "unclaimed_reward", nullable = false, precision = 78, scale = 0)
    private BigDecimal unclaimedReward;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void onWrite() {
        this.updatedAt = Instant.now();
    }

    static ParticipantEntity fromDomain(Participant participant) {
        ParticipantEntity entity = new ParticipantEntity();
        entity.identity = participant.getIdentity().toString();
        entity.updateFromDomain(participant);
        return entity;
    }

    void updateFromDomain(Participant participant) {
        this.pendingAmount = new BigDecimal(participant.getPendingAmount());
        this.lockedAmount = new BigDecimal(participant.getLockedAmount());
        this.lockEpoch = participant.getLockEpoch();
        this.rosterIndex = participant.getRosterIndex();
        this.active = participant.isActive();
        this.unclaimedReward = new BigDecimal(participant.getUnclaimedReward());
    }

    public Participant toDomain() {
        return Participant.restore(
            Address.of(identity),
            pendingAmount.toBigIntegerExact(),
            lockedAmount.toBigIntegerExact(),
            lockEpoch,
            rosterIndex,
            active,
            unclaimedReward.toBigIntegerExact()
        );
    }
}
