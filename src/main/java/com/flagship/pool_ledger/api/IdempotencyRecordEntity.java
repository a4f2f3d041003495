package com.flagship.pool_ledger.api;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for a used idempotency key and the serialized {@link IdempotencyRecord}.
 */
@Entity
@Table(
    name = "idempotency_records",
    indexes = @Index(name = "idx_idempotency_records_expires_at", columnList = "expires_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IdempotencyRecordEntity {

    @Id
    @Column(name = "scoped_key", nullable = false, updatable = false, length = 512)
    private String scopedKey;

    @Column(name = "record", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String record;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    static IdempotencyRecordEntity of(String scopedKey, String recordJson, Instant now, Instant expiresAt) {
        return new IdempotencyRecordEntity(scopedKey, recordJson, now, expiresAt);
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
