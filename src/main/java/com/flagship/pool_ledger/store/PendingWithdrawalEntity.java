package com.flagship.pool_ledger.store;

import com.flagship.pool_ledger.pool.Address;
import com.flagship.pool_ledger.pool.PendingWithdrawal;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * JPA entity for one queued withdrawal. {@code position} keeps the owner's queue in
 * request order.
 */
@Entity
@Table(
    name = "pending_withdrawals",
    indexes = @Index(name = "idx_pending_withdrawals_owner", columnList = "owner, position")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PendingWithdrawalEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner", nullable = false, updatable = false, length = 42)
    private String owner;

    @Column(name = "position", nullable = false, updatable = false)
    private int position;

    @Column(name = "amount", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigDecimal amount;

    @Column(name = "available_epoch", nullable = false, updatable = false)
    private long availableEpoch;

    static PendingWithdrawalEntity fromDomain(PendingWithdrawal withdrawal, int position) {
        return new PendingWithdrawalEntity(
            UUID.randomUUID(),
            withdrawal.getOwner().toString(),
            position,
            new BigDecimal(withdrawal.getAmount()),
            withdrawal.getAvailableEpoch()
        );
    }

    public PendingWithdrawal toDomain() {
        return new PendingWithdrawal(Address.of(owner), amount.toBigIntegerExact(), availableEpoch);
    }
}
