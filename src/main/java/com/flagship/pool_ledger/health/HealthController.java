package com.flagship.pool_ledger.health;

import com.flagship.pool_ledger.external.EpochOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
@Slf4j
public class HealthController {

    private final EpochOracle epochOracle;

    public HealthController(EpochOracle epochOracle) {
        this.epochOracle = epochOracle;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean oracleHealthy = checkEpochOracle();
        response.put("epochOracle", oracleHealthy ? "UP" : "DOWN");

        if (!oracleHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkEpochOracle() {
        try {
            return epochOracle.currentEpoch() >= 0;
        } catch (RuntimeException e) {
            log.warn("Epoch oracle check failed: {}", e.getMessage());
            return false;
        }
    }
}
