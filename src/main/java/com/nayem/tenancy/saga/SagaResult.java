package com.nayem.tenancy.saga;

import java.util.List;

/**
 * Outcome of one saga invocation.
 *
 * @param sagaName           Name of the saga
 * @param status             {@link SagaStatus#COMPLETED} or {@link SagaStatus#FAILED}
 * @param failedStepId       Step whose forward action failed, or null
 * @param error              The original forward failure, or null
 * @param completedSteps     Steps whose forward action succeeded, in execution order
 * @param compensatedSteps   Steps compensated without error, in compensation order
 * @param compensationErrors Compensations that failed, in compensation order
 */
public record SagaResult(
        String sagaName,
        SagaStatus status,
        String failedStepId,
        Throwable error,
        List<String> completedSteps,
        List<String> compensatedSteps,
        List<CompensationFailure> compensationErrors) {

    public SagaResult {
        completedSteps = List.copyOf(completedSteps);
        compensatedSteps = List.copyOf(compensatedSteps);
        compensationErrors = List.copyOf(compensationErrors);
    }

    public static SagaResult success(String sagaName, List<String> completedSteps) {
        return new SagaResult(sagaName, SagaStatus.COMPLETED, null, null, completedSteps, List.of(), List.of());
    }

    public boolean succeeded() {
        return status == SagaStatus.COMPLETED;
    }

    public boolean compensationSucceeded() {
        return compensationErrors.isEmpty();
    }

    /**
     * Whether any completed step had a compensation to run, i.e. whether the
     * failed saga may have left side effects behind.
     */
    public boolean hadSideEffects() {
        return !compensatedSteps.isEmpty() || !compensationErrors.isEmpty();
    }

    /**
     * A compensation that raised an error.
     */
    public record CompensationFailure(String stepId, Throwable error) {
    }
}
