package com.flagship.pool_ledger.api;

import com.flagship.pool_ledger.api.dto.AmountRequest;
import com.flagship.pool_ledger.api.dto.ClaimRewardsRequest;
import com.flagship.pool_ledger.api.dto.ClaimRewardsResponse;
import com.flagship.pool_ledger.api.dto.FeeUpdateRequest;
import com.flagship.pool_ledger.api.dto.GovernanceResponse;
import com.flagship.pool_ledger.api.dto.OperatorProposalRequest;
import com.flagship.pool_ledger.api.dto.ParticipantResponse;
import com.flagship.pool_ledger.api.dto.PauseRequest;
import com.flagship.pool_ledger.api.dto.PoolResponse;
import com.flagship.pool_ledger.api.dto.ReceiptResponse;
import com.flagship.pool_ledger.api.dto.SignatureVerificationRequest;
import com.flagship.pool_ledger.api.dto.SignatureVerificationResponse;
import com.flagship.pool_ledger.api.dto.WithdrawalResponse;
import com.flagship.pool_ledger.api.dto.WorkSubmissionRequest;
import com.flagship.pool_ledger.observability.CorrelationContext;
import com.flagship.pool_ledger.pool.Address;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for pool operations.
 *
 * The caller is identified by the X-Caller-Address header, set by the gateway after it
 * authenticates the request. Deposits and withdrawal requests require an Idempotency-Key
 * header; a repeated key returns the original receipt with 200 instead of 201/202.
 */
@RestController
@RequestMapping("/api/pool")
@RequiredArgsConstructor
@Slf4j
public class PoolController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String CALLER_HEADER = CorrelationContext.CALLER_HEADER;

    private final PoolService poolService;

    // ==================== Queries ====================

    @GetMapping
    public ResponseEntity<PoolResponse> getPool() {
        return ResponseEntity.ok(poolService.pool());
    }

    @GetMapping("/tier")
    public ResponseEntity<Map<String, Integer>> getTier() {
        return ResponseEntity.ok(Map.of("tier", poolService.tier()));
    }

    @GetMapping("/depositors/count")
    public ResponseEntity<Map<String, Integer>> getDepositorCount() {
        return ResponseEntity.ok(Map.of("depositor_count", poolService.depositorCount()));
    }

    @GetMapping("/participants/{address}")
    public ResponseEntity<ParticipantResponse> getParticipant(@PathVariable("address") String address) {
        return ResponseEntity.ok(poolService.participant(Address.of(address)));
    }

    @GetMapping("/participants/{address}/withdrawals")
    public ResponseEntity<List<WithdrawalResponse>> getPendingWithdrawals(@PathVariable("address") String address) {
        return ResponseEntity.ok(poolService.pendingWithdrawals(Address.of(address)));
    }

    // ==================== Participant operations ====================

    @PostMapping("/deposits")
    public ResponseEntity<ReceiptResponse> deposit(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody AmountRequest request) {

        log.info("Received deposit request: idempotencyKey={}, amount={}", idempotencyKey, request.getAmount());
        PoolService.Outcome outcome = poolService.deposit(Address.of(caller), request.getAmount(), idempotencyKey);
        return respond(outcome, HttpStatus.CREATED);
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<ReceiptResponse> requestWithdrawal(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody AmountRequest request) {

        log.info("Received withdrawal request: idempotencyKey={}, amount={}", idempotencyKey, request.getAmount());
        PoolService.Outcome outcome =
            poolService.requestWithdrawal(Address.of(caller), request.getAmount(), idempotencyKey);
        return respond(outcome, HttpStatus.ACCEPTED);
    }

    @PostMapping("/withdrawals/complete")
    public ResponseEntity<ReceiptResponse> completeWithdrawal(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(poolService.completeWithdrawal(Address.of(caller)));
    }

    @PostMapping("/withdrawals/emergency")
    public ResponseEntity<ReceiptResponse> emergencyWithdraw(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(poolService.emergencyWithdraw(Address.of(caller)));
    }

    @PostMapping("/rewards/payout")
    public ResponseEntity<ReceiptResponse> claimUserRewards(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(poolService.claimUserRewards(Address.of(caller)));
    }

    @PostMapping("/rewards/claim")
    public ResponseEntity<ClaimRewardsResponse> claimRewards(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody ClaimRewardsRequest request) {
        return ResponseEntity.ok(poolService.claimRewards(Address.of(caller), request.getEpochIds()));
    }

    @PostMapping("/epochs/process")
    public ResponseEntity<PoolResponse> processEpoch(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(poolService.processEpoch(Address.of(caller)));
    }

    // ==================== Operator operations ====================

    @PostMapping("/work")
    public ResponseEntity<ReceiptResponse> submitWork(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody WorkSubmissionRequest request) {
        byte[] payload = decodeHex(request.getPayload());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(poolService.submitWork(Address.of(caller), payload));
    }

    @PutMapping("/operator/fee")
    public ResponseEntity<GovernanceResponse> setFee(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody FeeUpdateRequest request) {
        return ResponseEntity.ok(poolService.setFee(Address.of(caller), request.getFeeBps()));
    }

    @PostMapping("/operator/proposal")
    public ResponseEntity<GovernanceResponse> proposeOperator(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody OperatorProposalRequest request) {
        return ResponseEntity.ok(poolService.proposeOperator(Address.of(caller), Address.of(request.getCandidate())));
    }

    @PostMapping("/operator/acceptance")
    public ResponseEntity<GovernanceResponse> acceptOperator(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(poolService.acceptOperator(Address.of(caller)));
    }

    @PutMapping("/paused")
    public ResponseEntity<GovernanceResponse> setPaused(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody PauseRequest request) {
        return ResponseEntity.ok(poolService.setPaused(Address.of(caller), request.getPaused()));
    }

    // ==================== Signatures ====================

    @PostMapping("/signatures/verify")
    public ResponseEntity<SignatureVerificationResponse> verifySignature(
            @Valid @RequestBody SignatureVerificationRequest request) {
        return ResponseEntity.ok(poolService.verifySignature(
            decodeHex(request.getHash()), decodeHex(request.getSignature())));
    }

    private static ResponseEntity<ReceiptResponse> respond(PoolService.Outcome outcome, HttpStatus created) {
        if (outcome.isReplayed()) {
            return ResponseEntity.ok(outcome.getReceipt());
        }
        return ResponseEntity.status(created).body(outcome.getReceipt());
    }

    private static byte[] decodeHex(String hex) {
        String digits = hex.startsWith("0x") ? hex.substring(2) : hex;
        return Hex.decode(digits);
    }
}
