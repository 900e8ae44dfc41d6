package com.nayem.tenancy.reconcile;

/**
 * Aggregate outcome of one reconciliation cycle.
 *
 * @param fetched   Events returned by the provider for the window
 * @param succeeded Events materialized locally
 * @param skipped   Events already materialized by an earlier cycle or saga
 * @param failed    Events that were invalid or could not be materialized
 * @param cancelled Whether the cycle stopped early because it was cancelled
 */
public record ReconciliationReport(int fetched, int succeeded, int skipped, int failed, boolean cancelled) {

    static ReconciliationReport notRun() {
        return new ReconciliationReport(0, 0, 0, 0, false);
    }

    /**
     * @return events the cycle never got to
     */
    public int unprocessed() {
        return fetched - succeeded - skipped - failed;
    }
}
