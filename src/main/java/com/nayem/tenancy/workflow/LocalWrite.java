package com.nayem.tenancy.workflow;

import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.store.UnitOfWork;

/**
 * Stages writes in an open unit of work and returns what the caller needs
 * once they are committed.
 */
@FunctionalInterface
interface LocalWrite<R> {

    R stage(UnitOfWork uow, SagaContext context) throws Exception;
}
