package com.nayem.tenancy.saga;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes a saga's steps in order on the calling thread.
 * <p>
 * Forward execution is fail-fast: the first failing step stops the saga and
 * no later step runs. Every step that completed is then offered exactly one
 * compensation, in reverse order. A failing compensation is recorded and the
 * pass continues with the next (earlier) step. The step that failed is never
 * compensated.
 * </p>
 * <p>
 * The engine holds no per-invocation state, so one instance serves any
 * number of concurrent sagas.
 * </p>
 */
public class SagaEngine {

    private static final Logger log = LoggerFactory.getLogger(SagaEngine.class);

    static final String MDC_SAGA = "saga";
    static final String MDC_STEP = "sagaStep";

    private final SagaMetrics metrics;

    public SagaEngine(SagaMetrics metrics) {
        this.metrics = metrics;
    }

    public SagaEngine() {
        this(SagaMetrics.noOp());
    }

    /**
     * Runs the saga and reports the outcome. Step failures are returned in the
     * result, not thrown.
     */
    public SagaResult run(TenancySaga saga, SagaContext context) {
        String sagaName = saga.getSagaName();
        long startTime = System.currentTimeMillis();
        List<SagaStep> completed = new ArrayList<>();

        MDC.put(MDC_SAGA, sagaName);
        try {
            log.info("Starting saga {} ({} steps)", saga.getDescription(), saga.getSteps().size());

            for (SagaStep step : saga.getSteps()) {
                MDC.put(MDC_STEP, step.getStepId());
                try {
                    context.signal().throwIfCancelled();
                    log.info("Saga {} step {} starting", sagaName, step.getStepId());
                    step.execute(context);
                    completed.add(step);
                    log.debug("Saga {} step {} completed", sagaName, step.getStepId());
                } catch (Exception e) {
                    log.error("Saga {} failed at step {}. Starting compensation. State: {}",
                            sagaName, step.getStepId(), context.describe(), e);
                    SagaResult result = compensate(saga, completed, step, e, context);
                    metrics.recordFailedSaga(sagaName);
                    metrics.recordSagaDuration(sagaName, System.currentTimeMillis() - startTime, SagaStatus.FAILED);
                    return result;
                }
            }

            log.info("Saga {} completed successfully", sagaName);
            metrics.recordCompletedSaga(sagaName);
            metrics.recordSagaDuration(sagaName, System.currentTimeMillis() - startTime, SagaStatus.COMPLETED);
            return SagaResult.success(sagaName, completed.stream().map(SagaStep::getStepId).toList());
        } finally {
            MDC.remove(MDC_STEP);
            MDC.remove(MDC_SAGA);
        }
    }

    /**
     * Runs the saga and re-raises its forward failure, after compensation, as a
     * {@link SagaExecutionException} whose cause is the original error.
     */
    public SagaResult execute(TenancySaga saga, SagaContext context) {
        SagaResult result = run(saga, context);
        if (!result.succeeded()) {
            throw new SagaExecutionException(result);
        }
        return result;
    }

    private SagaResult compensate(TenancySaga saga, List<SagaStep> completed, SagaStep failedStep,
            Exception cause, SagaContext context) {
        metrics.recordCompensationTriggered();

        // Compensation must run to the end even if the caller's thread was interrupted.
        boolean interrupted = Thread.interrupted() || cause instanceof InterruptedException;
        SagaContext compensationContext = context.forCompensation();
        List<String> compensated = new ArrayList<>();
        List<SagaResult.CompensationFailure> failures = new ArrayList<>();

        try {
            for (int i = completed.size() - 1; i >= 0; i--) {
                SagaStep step = completed.get(i);
                if (!step.hasCompensation()) {
                    continue;
                }
                MDC.put(MDC_STEP, step.getStepId());
                try {
                    log.warn("Saga {} compensating step {}", saga.getSagaName(), step.getStepId());
                    step.compensate(compensationContext);
                    compensated.add(step.getStepId());
                    log.info("Saga {} step {} compensated", saga.getSagaName(), step.getStepId());
                } catch (Exception e) {
                    failures.add(new SagaResult.CompensationFailure(step.getStepId(), e));
                    metrics.recordCompensationFailure();
                    log.error("Saga {} compensation of step {} failed, continuing with earlier steps",
                            saga.getSagaName(), step.getStepId(), e);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        if (failures.isEmpty()) {
            log.warn("Saga {} failed at step {}; all {} compensations succeeded",
                    saga.getSagaName(), failedStep.getStepId(), compensated.size());
        } else {
            log.error("Saga {} failed at step {}; {} compensation(s) failed, manual reconciliation required",
                    saga.getSagaName(), failedStep.getStepId(), failures.size());
        }

        return new SagaResult(
                saga.getSagaName(),
                SagaStatus.FAILED,
                failedStep.getStepId(),
                cause,
                completed.stream().map(SagaStep::getStepId).toList(),
                compensated,
                failures);
    }
}
