package com.nayem.tenancy.reconcile;

/**
 * Lock for single-instance deployments, where the scheduler's own
 * single-flight guard is enough.
 */
public class NoOpReconciliationLock implements ReconciliationLock {

    @Override
    public boolean acquireLock(String lockKey, long lockDurationMs) {
        return true;
    }

    @Override
    public void releaseLock(String lockKey) {
    }
}
