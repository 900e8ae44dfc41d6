package com.nayem.tenancy.saga;

/**
 * Final status of a saga invocation.
 */
public enum SagaStatus {

    /**
     * Saga completed successfully (all steps executed).
     */
    COMPLETED,

    /**
     * A forward step failed; compensation has been attempted for every completed step.
     */
    FAILED
}
