package com.nayem.tenancy.store;

import com.nayem.tenancy.saga.CancellationSignal;

/**
 * One transaction's view of the store.
 * <p>
 * Reads outside a transaction see committed state. Writes require an active
 * transaction and stay invisible to every other unit of work until
 * {@link #commit()}. A unit of work belongs to exactly one saga invocation.
 * </p>
 */
public interface UnitOfWork {

    /**
     * @throws IllegalStateException if a transaction is already active
     */
    void begin();

    /**
     * Apply staged writes atomically. On failure the transaction is rolled back
     * before the exception propagates.
     *
     * @throws StoreException if a constraint is violated
     */
    void commit();

    /**
     * Commit unless the caller's signal is already cancelled, in which case
     * the transaction stays open for the caller to roll back. A store backed
     * by a database bounds the commit by {@link CancellationSignal#remaining()}.
     *
     * @throws java.util.concurrent.CancellationException if the signal is cancelled
     */
    default void commit(CancellationSignal signal) {
        signal.throwIfCancelled();
        commit();
    }

    /**
     * Discard staged writes. Calling it without an active transaction is a no-op.
     */
    void rollback();

    boolean isActive();

    UserRepository users();

    TenantRepository tenants();

    ExternalIdentityRepository mappings();

    MembershipRepository memberships();

    ProfileRepository profiles();
}
