package com.flagship.money_transfer.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for money transfers.
 *
 * Metrics exposed:
 * - transfer.completed: Counter of finished transfer attempts, tagged by outcome
 * - transfer.duration: Timer for transfer attempts, tagged by outcome
 * - transfer.amount: Summary of successfully moved amounts
 */
@Component
public class TransferMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_INVALID = "invalid";
    public static final String OUTCOME_NOT_FOUND = "not_found";
    public static final String OUTCOME_CONFLICT = "conflict";
    public static final String OUTCOME_TIMEOUT = "timeout";
    public static final String OUTCOME_ROLLBACK_FAILED = "rollback_failed";
    public static final String OUTCOME_COMMIT_FAILED = "commit_failed";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransfer(String outcome, long durationMs) {
        registry.counter("transfer.completed", "outcome", outcome).increment();
        registry.timer("transfer.duration", "outcome", outcome).record(Duration.ofMillis(durationMs));
    }

    public void recordAmount(long amount) {
        registry.summary("transfer.amount").record(amount);
    }
}
