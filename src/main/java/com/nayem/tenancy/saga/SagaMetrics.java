package com.nayem.tenancy.saga;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for saga execution and registration reconciliation.
 */
public class SagaMetrics {

    private final MeterRegistry registry;
    private final Counter compensationCounter;
    private final Counter compensationFailureCounter;
    private final Counter reconciledCounter;
    private final Counter reconcileSkippedCounter;
    private final Counter reconcileFailedCounter;

    public SagaMetrics(MeterRegistry registry) {
        this.registry = registry;

        if (registry != null) {
            this.compensationCounter = Counter.builder("tenancy.saga.compensation.count")
                    .description("Number of compensation passes triggered")
                    .register(registry);

            this.compensationFailureCounter = Counter.builder("tenancy.saga.compensation.failures")
                    .description("Number of individual compensations that failed")
                    .register(registry);

            this.reconciledCounter = Counter.builder("tenancy.reconciliation.processed")
                    .description("Registrations materialized into the local store")
                    .register(registry);

            this.reconcileSkippedCounter = Counter.builder("tenancy.reconciliation.skipped")
                    .description("Registrations already present locally")
                    .register(registry);

            this.reconcileFailedCounter = Counter.builder("tenancy.reconciliation.failed")
                    .description("Registrations that could not be materialized")
                    .register(registry);
        } else {
            this.compensationCounter = null;
            this.compensationFailureCounter = null;
            this.reconciledCounter = null;
            this.reconcileSkippedCounter = null;
            this.reconcileFailedCounter = null;
        }
    }

    public void recordSagaDuration(String sagaName, long durationMs, SagaStatus status) {
        if (registry != null) {
            Timer.builder("tenancy.saga.duration")
                    .description("Total saga execution duration")
                    .tag("saga", sagaName)
                    .tag("status", status.name().toLowerCase())
                    .register(registry)
                    .record(durationMs, TimeUnit.MILLISECONDS);
        }
    }

    public void recordCompletedSaga(String sagaName) {
        if (registry != null) {
            registry.counter("tenancy.saga.completed", "saga", sagaName).increment();
        }
    }

    public void recordFailedSaga(String sagaName) {
        if (registry != null) {
            registry.counter("tenancy.saga.failed", "saga", sagaName).increment();
        }
    }

    public void recordCompensationTriggered() {
        if (compensationCounter != null) {
            compensationCounter.increment();
        }
    }

    public void recordCompensationFailure() {
        if (compensationFailureCounter != null) {
            compensationFailureCounter.increment();
        }
    }

    public void recordReconciliation(int processed, int skipped, int failed) {
        if (reconciledCounter != null) {
            reconciledCounter.increment(processed);
            reconcileSkippedCounter.increment(skipped);
            reconcileFailedCounter.increment(failed);
        }
    }

    public static SagaMetrics noOp() {
        return new SagaMetrics(null);
    }
}
