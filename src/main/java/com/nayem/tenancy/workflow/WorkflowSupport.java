package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureLog;
import com.nayem.tenancy.identity.IdentityProviderClient;
import com.nayem.tenancy.saga.SagaEngine;
import com.nayem.tenancy.store.TransactionalStore;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Collaborators shared by every provisioning workflow.
 *
 * @param engine     Runs the sagas
 * @param provider   The external identity provider
 * @param store      The local transactional store
 * @param failureLog Receives a record for every failed saga that left side effects
 * @param providerId Id of the identity provider in external identity mappings
 * @param clock      Source of timestamps
 */
public record WorkflowSupport(
        SagaEngine engine,
        IdentityProviderClient provider,
        TransactionalStore store,
        FailureLog failureLog,
        UUID providerId,
        Clock clock) {

    public WorkflowSupport {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(failureLog, "failureLog");
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(clock, "clock");
    }
}
