package com.flagship.pool_ledger.observability;

import java.util.UUID;

/**
 * Header and MDC keys for correlation ID propagation.
 *
 * The correlation ID flows through:
 * - HTTP requests (from header or generated)
 * - Epoch tick consumption (one ID per record)
 * - All log statements (via MDC)
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CALLER_HEADER = "X-Caller-Address";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_MDC_KEY = "caller";
    public static final String OPERATION_MDC_KEY = "operation";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
