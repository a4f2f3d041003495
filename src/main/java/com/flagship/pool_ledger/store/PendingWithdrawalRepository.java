package com.flagship.pool_ledger.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PendingWithdrawalRepository extends JpaRepository<PendingWithdrawalEntity, UUID> {

    List<PendingWithdrawalEntity> findAllByOrderByOwnerAscPositionAsc();

    /**
     * Clears an owner's queue before it is rewritten.
     */
    @Modifying
    @Query("DELETE FROM PendingWithdrawalEntity w WHERE w.owner = :owner")
    int deleteByOwner(@Param("owner") String owner);
}
