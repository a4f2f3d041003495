package com.flagship.pool_ledger.api;

import com.flagship.pool_ledger.api.dto.ClaimRewardsResponse;
import com.flagship.pool_ledger.api.dto.GovernanceResponse;
import com.flagship.pool_ledger.api.dto.ParticipantResponse;
import com.flagship.pool_ledger.api.dto.PoolResponse;
import com.flagship.pool_ledger.api.dto.ReceiptResponse;
import com.flagship.pool_ledger.api.dto.SignatureVerificationResponse;
import com.flagship.pool_ledger.api.dto.WithdrawalResponse;
import com.flagship.pool_ledger.auth.SignatureAuthenticator;
import com.flagship.pool_ledger.auth.SignatureVerdict;
import com.flagship.pool_ledger.observability.CorrelationContext;
import com.flagship.pool_ledger.observability.PoolMetrics;
import com.flagship.pool_ledger.pool.Address;
import com.flagship.pool_ledger.pool.EpochProcessor;
import com.flagship.pool_ledger.pool.PoolEngine;
import com.flagship.pool_ledger.pool.PoolErrorCode;
import com.flagship.pool_ledger.pool.PoolException;
import com.flagship.pool_ledger.pool.event.DepositedEvent;
import com.flagship.pool_ledger.pool.event.EmergencyWithdrawnEvent;
import com.flagship.pool_ledger.pool.event.RewardsClaimedEvent;
import com.flagship.pool_ledger.pool.event.UserRewardsClaimedEvent;
import com.flagship.pool_ledger.pool.event.WithdrawalCompletedEvent;
import com.flagship.pool_ledger.pool.event.WithdrawalRequestedEvent;
import com.flagship.pool_ledger.pool.event.WorkSubmittedEvent;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Application service in front of the accounting engine.
 *
 * Adds what the engine leaves to its host: idempotent retries for deposits and withdrawal
 * requests, caller and operation in MDC, metrics, and one log line per outcome. Rejections
 * are logged at WARN, collaborator failures at ERROR.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolService {

    static final String DEPOSIT = "deposit";
    static final String REQUEST_WITHDRAWAL = "request_withdrawal";
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private final PoolEngine engine;
    private final IdempotencyService idempotencyService;
    private final SignatureAuthenticator signatureAuthenticator;
    private final PoolMetrics metrics;

    // ==================== Idempotent operations ====================

    /**
     * Deposits on behalf of the caller. A retry with the same key and amount returns the
     * original receipt without depositing again.
     */
    public synchronized Outcome deposit(Address caller, BigInteger amount, String idempotencyKey) {
        return idempotent(DEPOSIT, caller, idempotencyKey, String.valueOf(amount), () -> {
            DepositedEvent event = engine.deposit(caller, amount);
            metrics.recordDeposit(amount);
            log.info("Deposit accepted: amount={}, lockEpoch={}", amount, event.getLockEpoch());
            return ReceiptResponse.builder()
                .receiptId(event.getEventId())
                .operation(DEPOSIT)
                .caller(caller.toString())
                .amount(event.getAmount())
                .lockEpoch(event.getLockEpoch())
                .occurredAt(event.getOccurredAt())
                .build();
        });
    }

    public synchronized Outcome requestWithdrawal(Address caller, BigInteger amount, String idempotencyKey) {
        return idempotent(REQUEST_WITHDRAWAL, caller, idempotencyKey, String.valueOf(amount), () -> {
            WithdrawalRequestedEvent event = engine.requestWithdrawal(caller, amount);
            log.info("Withdrawal queued: amount={}, fromPending={}, fromLocked={}, availableEpoch={}",
                amount, event.getFromPending(), event.getFromLocked(), event.getAvailableEpoch());
            return ReceiptResponse.builder()
                .receiptId(event.getEventId())
                .operation(REQUEST_WITHDRAWAL)
                .caller(caller.toString())
                .amount(event.getAmount())
                .fromPending(event.getFromPending())
                .fromLocked(event.getFromLocked())
                .availableEpoch(event.getAvailableEpoch())
                .occurredAt(event.getOccurredAt())
                .build();
        });
    }

    // ==================== Other participant operations ====================

    public ReceiptResponse completeWithdrawal(Address caller) {
        return execute("complete_withdrawal", caller, () -> {
            WithdrawalCompletedEvent event = engine.completeWithdrawal(caller);
            metrics.recordWithdrawal("queued", event.getAmount());
            log.info("Withdrawal completed: amount={}, records={}", event.getAmount(), event.getReleasedRecords());
            return ReceiptResponse.builder()
                .receiptId(event.getEventId())
                .operation("complete_withdrawal")
                .caller(caller.toString())
                .amount(event.getAmount())
                .releasedRecords(event.getReleasedRecords())
                .occurredAt(event.getOccurredAt())
                .build();
        });
    }

    public ReceiptResponse emergencyWithdraw(Address caller) {
        return execute("emergency_withdraw", caller, () -> {
            EmergencyWithdrawnEvent event = engine.emergencyWithdraw(caller);
            metrics.recordWithdrawal("emergency", event.getTotal());
            log.warn("Emergency withdrawal: total={}, pending={}, locked={}, queued={}, rewards={}",
                event.getTotal(), event.getPending(), event.getLocked(), event.getQueued(),
                event.getUnclaimedReward());
            return ReceiptResponse.builder()
                .receiptId(event.getEventId())
                .operation("emergency_withdraw")
                .caller(caller.toString())
                .amount(event.getTotal())
                .occurredAt(event.getOccurredAt())
                .build();
        });
    }

    public ReceiptResponse claimUserRewards(Address caller) {
        return execute("claim_user_rewards", caller, () -> {
            UserRewardsClaimedEvent event = engine.claimUserRewards(caller);
            log.info("Rewards paid out: amount={}", event.getAmount());
            return ReceiptResponse.builder()
                .receiptId(event.getEventId())
                .operation("claim_user_rewards")
                .caller(caller.toString())
                .amount(event.getAmount())
                .occurredAt(event.getOccurredAt())
                .build();
        });
    }

    public ClaimRewardsResponse claimRewards(Address caller, List<Long> epochIds) {
        return execute("claim_rewards", caller, () -> {
            RewardsClaimedEvent event = engine.claimRewards(caller, epochIds);
            metrics.recordRewards(event.getTotalReward(), event.getOperatorFee());
            log.info("Rewards claimed: epochs={}, total={}, fee={}, distributed={}, undistributed={}, recipients={}",
                event.getEpochIds(), event.getTotalReward(), event.getOperatorFee(), event.getDistributed(),
                event.getUndistributed(), event.getRecipients());
            return ClaimRewardsResponse.from(event);
        });
    }

    public PoolResponse processEpoch(Address caller) {
        return execute("process_epoch", caller, () -> {
            EpochProcessor.EpochTransition transition = engine.processEpoch(caller);
            if (transition.isAdvanced()) {
                metrics.incrementEpochsProcessed();
                log.info("Epoch processed: {} -> {}, promoted {} for {} participants",
                    transition.getPreviousEpoch(), transition.getEpoch(), transition.getPromotedAmount(),
                    transition.getPromotedParticipants());
            }
            return PoolResponse.from(engine.pool());
        });
    }

    // ==================== Operator operations ====================

    public ReceiptResponse submitWork(Address caller, byte[] payload) {
        return execute("submit_work", caller, () -> {
            WorkSubmittedEvent event = engine.submitWork(caller, payload);
            log.info("Work submitted: {} bytes", event.getPayloadSize());
            return ReceiptResponse.builder()
                .receiptId(event.getEventId())
                .operation("submit_work")
                .caller(caller.toString())
                .payloadSize(event.getPayloadSize())
                .occurredAt(event.getOccurredAt())
                .build();
        });
    }

    public GovernanceResponse setFee(Address caller, int feeBps) {
        return execute("set_fee", caller, () -> {
            int previous = engine.setFee(caller, feeBps).getPreviousFeeBps();
            log.info("Operator fee changed: {} -> {} bps", previous, feeBps);
            return governance();
        });
    }

    public GovernanceResponse proposeOperator(Address caller, Address candidate) {
        return execute("propose_operator", caller, () -> {
            engine.proposeOperator(caller, candidate);
            log.info("Operator proposal: candidate={}", candidate);
            return governance();
        });
    }

    public GovernanceResponse acceptOperator(Address caller) {
        return execute("accept_operator", caller, () -> {
            Address previous = engine.acceptOperator(caller).getPreviousOperator();
            log.info("Operator handed over: {} -> {}", previous, caller);
            return governance();
        });
    }

    public GovernanceResponse setPaused(Address caller, boolean paused) {
        return execute("set_paused", caller, () -> {
            engine.setPaused(caller, paused);
            log.info("Pool {}", paused ? "paused" : "unpaused");
            return governance();
        });
    }

    // ==================== Queries ====================

    public PoolResponse pool() {
        return PoolResponse.from(engine.pool());
    }

    public int tier() {
        return engine.tier();
    }

    public int depositorCount() {
        return engine.depositorCount();
    }

    public ParticipantResponse participant(Address identity) {
        return ParticipantResponse.from(engine.participant(identity));
    }

    public List<WithdrawalResponse> pendingWithdrawals(Address owner) {
        return engine.pendingWithdrawals(owner).stream().map(WithdrawalResponse::from).toList();
    }

    /**
     * Checks a signature against the current operator.
     */
    public SignatureVerificationResponse verifySignature(byte[] hash, byte[] signature) {
        SignatureVerdict verdict = signatureAuthenticator.verify(hash, signature, engine.currentOperator());
        log.debug("Signature verification: {}", verdict);
        return new SignatureVerificationResponse(verdict.toHex());
    }

    // ==================== Internals ====================

    private GovernanceResponse governance() {
        return GovernanceResponse.from(engine.operatorState(), engine.isPaused());
    }

    private Outcome idempotent(String operation, Address caller, String idempotencyKey, String fingerprint,
                               Supplier<ReceiptResponse> action) {
        if (idempotencyKey != null && idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new IllegalArgumentException(
                "Idempotency key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        String scopedKey = operation + ":" + caller + ":" + idempotencyKey;

        var existing = idempotencyService.find(scopedKey);
        if (existing.isPresent()) {
            if (!existing.get().getFingerprint().equals(fingerprint)) {
                throw new IllegalStateException(
                    "Idempotency key '" + idempotencyKey + "' was already used for a different " + operation);
            }
            metrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning existing receipt: operation={}, key={}",
                operation, idempotencyKey);
            return new Outcome(existing.get().getReceipt(), true);
        }
        metrics.recordIdempotencyMiss();

        ReceiptResponse receipt = execute(operation, caller, action);
        idempotencyService.store(scopedKey, IdempotencyRecord.builder()
            .fingerprint(fingerprint)
            .receipt(receipt)
            .build());
        return new Outcome(receipt, false);
    }

    private <T> T execute(String operation, Address caller, Supplier<T> action) {
        long startTime = System.nanoTime();
        String outerCaller = MDC.get(CorrelationContext.CALLER_MDC_KEY);
        MDC.put(CorrelationContext.CALLER_MDC_KEY, caller.toString());
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, operation);
        try {
            T result = action.get();
            metrics.recordSuccess(operation);
            return result;
        } catch (PoolException e) {
            metrics.recordFailure(operation, e.getCode());
            if (e.getCategory() == PoolErrorCode.Category.EXTERNAL) {
                log.error("{} failed: code={}, error={}", operation, e.getCode(), e.getMessage());
            } else {
                log.warn("{} rejected: code={}, reason={}", operation, e.getCode(), e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            metrics.recordUnexpectedFailure(operation);
            log.error("{} failed unexpectedly", operation, e);
            throw e;
        } finally {
            metrics.recordLatency(operation, Duration.ofNanos(System.nanoTime() - startTime));
            MDC.remove(CorrelationContext.OPERATION_MDC_KEY);
            // the request filter may have set the caller already
            if (outerCaller == null) {
                MDC.remove(CorrelationContext.CALLER_MDC_KEY);
            } else {
                MDC.put(CorrelationContext.CALLER_MDC_KEY, outerCaller);
            }
        }
    }

    /**
     * Receipt of an idempotent operation. {@code replayed} is set when the receipt came from
     * an earlier request with the same key.
     */
    @Value
    public static class Outcome {
        ReceiptResponse receipt;
        boolean replayed;
    }
}
