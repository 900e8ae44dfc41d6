package com.nayem.tenancy.store;

/**
 * The local relational store, as seen by the sagas.
 * <p>
 * Implementations hand out a fresh {@link UnitOfWork} per saga invocation so
 * no two invocations ever share an open transaction.
 * </p>
 */
public interface TransactionalStore {

    UnitOfWork openUnitOfWork();
}
