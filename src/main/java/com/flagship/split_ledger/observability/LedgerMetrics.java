package com.flagship.split_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.expenses.recorded: expenses appended, tagged by currency and outcome
 * - ledger.expenses.voided: void transitions
 * - ledger.rates.resolved: successful rate resolutions, tagged by layer and cache hit
 * - ledger.rates.unavailable: pairs for which every layer failed
 * - ledger.settlement.duration: time to compute a settlement plan
 * - ledger.latency: latency of ledger operations, tagged by operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter expensesVoided;
    private final Timer settlementTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.expensesVoided = Counter.builder("ledger.expenses.voided")
                .description("Number of expenses voided")
                .register(registry);

        this.settlementTimer = Timer.builder("ledger.settlement.duration")
                .description("Time taken to plan a settlement")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordExpenseRecorded(String currency, String outcome) {
        registry.counter("ledger.expenses.recorded",
                "currency", sanitizeTag(currency),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void incrementExpensesVoided() {
        expensesVoided.increment();
    }

    public void recordRateResolved(String layer, boolean cacheHit) {
        registry.counter("ledger.rates.resolved",
                "layer", sanitizeTag(layer),
                "cache", cacheHit ? "hit" : "miss"
        ).increment();
    }

    public void recordRateUnavailable(String from, String to) {
        registry.counter("ledger.rates.unavailable",
                "pair", sanitizeTag(from + "_" + to)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public <T> T timeSettlement(Supplier<T> operation) {
        return settlementTimer.record(operation);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values short and alphanumeric to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
