package com.nayem.tenancy.saga;

/**
 * Raised when a saga's forward step failed.
 * <p>
 * The cause is always the original forward failure. Compensation errors are
 * attached as suppressed exceptions and never replace the cause. The message
 * names only the saga and the failing step.
 * </p>
 */
public class SagaExecutionException extends RuntimeException {

    private final transient SagaResult result;

    public SagaExecutionException(SagaResult result) {
        super("Saga '" + result.sagaName() + "' failed at step '" + result.failedStepId() + "'", result.error());
        this.result = result;
        result.compensationErrors().forEach(failure -> addSuppressed(failure.error()));
    }

    public SagaResult getResult() {
        return result;
    }

    public String getFailedStepId() {
        return result.failedStepId();
    }
}
