package com.nayem.tenancy.saga;

/**
 * Represents an individual step within a saga.
 * <p>
 * Each step has:
 * - A forward action (execute)
 * - An optional compensating action (compensate) for rollback
 * </p>
 * <p>
 * Both actions work against the shared {@link SagaContext}. A forward action
 * records the facts it produced only after it succeeded, and a compensation
 * decides what to undo from those facts alone.
 * </p>
 */
public interface SagaStep {

    /**
     * Unique identifier for this step within its saga.
     * Used for logging and for the compensation report.
     */
    String getStepId();

    /**
     * Execute the forward action.
     *
     * @param context The facts accumulated by earlier steps
     * @throws Exception if the action failed; the saga stops and compensates
     */
    void execute(SagaContext context) throws Exception;

    /**
     * Compensate this step after a later step failed.
     * <p>
     * Must tolerate resources that are already gone.
     * </p>
     *
     * @param context The saga facts, bound to a signal that is never cancelled
     */
    default void compensate(SagaContext context) throws Exception {
    }

    /**
     * Whether this step registers a compensation.
     * Steps without one (pure reads) are skipped during the reverse pass.
     */
    default boolean hasCompensation() {
        return false;
    }
}
