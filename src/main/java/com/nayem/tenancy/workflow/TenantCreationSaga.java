package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.ContextKey;
import com.nayem.tenancy.saga.SagaBuilder;
import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.saga.TenancySaga;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.ExternalIdentityMapping;
import com.nayem.tenancy.store.Tenant;
import com.nayem.tenancy.store.UnitOfWork;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;

/**
 * Creates a tenant without any user: create-organization, then persist-tenant.
 */
public class TenantCreationSaga extends AbstractProvisioningWorkflow {

    static final String NAME = "tenant-creation";

    private static final ContextKey<UUID> TENANT_ID = ContextKey.of("internalTenantId", UUID.class);

    public TenantCreationSaga(WorkflowSupport support) {
        super(support);
    }

    /**
     * @return the internal id of the new tenant
     */
    public UUID createTenant(NewTenantRequest request, CancellationSignal signal) {
        UnitOfWork uow = support.store().openUnitOfWork();
        TenancySaga saga = SagaBuilder.newSaga(NAME)
                .description("Create tenant " + request.name() + " (" + request.domain() + ")")
                .step(steps.createOrganization(request.toOrganization()))
                .step(steps.persistLocally("persist-tenant", uow, TENANT_ID,
                        (tx, ctx) -> persist(tx, ctx.require(EXTERNAL_ORG_ID), request)))
                .build();

        SagaContext context = new SagaContext(signal);
        runAudited(saga, context, FailureRecord.builder(NAME));
        return context.require(TENANT_ID);
    }

    private UUID persist(UnitOfWork uow, String externalOrgId, NewTenantRequest request) {
        return uow.mappings().find(support.providerId(), externalOrgId)
                .map(ExternalIdentityMapping::internalId)
                .orElseGet(() -> {
                    Instant now = support.clock().instant();
                    Tenant tenant = new Tenant(UUID.randomUUID(), request.name(), List.of(request.domain()), now);
                    uow.tenants().add(tenant);
                    uow.mappings().add(ExternalIdentityMapping.create(
                            tenant.id(), externalOrgId, EntityKind.TENANT, support.providerId(), now));
                    return tenant.id();
                });
    }
}
