package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_ledger.pool.PendingWithdrawal;
import lombok.Value;

import java.math.BigInteger;

@Value
public class WithdrawalResponse {

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("available_epoch")
    long availableEpoch;

    public static WithdrawalResponse from(PendingWithdrawal withdrawal) {
        return new WithdrawalResponse(withdrawal.getAmount(), withdrawal.getAvailableEpoch());
    }
}
