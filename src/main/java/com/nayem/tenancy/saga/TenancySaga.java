package com.nayem.tenancy.saga;

import java.util.List;

/**
 * Defines a complete saga with ordered steps.
 * <p>
 * A saga is a sequence of steps where each step may have a compensating
 * action. If any step fails, previously completed steps are compensated in
 * reverse order.
 * </p>
 */
public interface TenancySaga {

    /**
     * Name of the workflow, used in logs, metrics and failure records.
     */
    String getSagaName();

    /**
     * Ordered list of steps to execute.
     * Steps are executed in order; on failure, compensation runs in reverse.
     */
    List<SagaStep> getSteps();

    /**
     * Optional: Provides a description for logging/monitoring.
     */
    default String getDescription() {
        return getSagaName();
    }
}
