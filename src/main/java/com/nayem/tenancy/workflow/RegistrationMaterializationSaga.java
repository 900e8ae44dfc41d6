package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.identity.RegistrationEvent;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.ContextKey;
import com.nayem.tenancy.saga.FunctionalSagaStep;
import com.nayem.tenancy.saga.SagaBuilder;
import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.saga.SagaStep;
import com.nayem.tenancy.saga.TenancySaga;
import com.nayem.tenancy.store.TenantRole;
import com.nayem.tenancy.store.UnitOfWork;

import java.time.Instant;
import java.util.UUID;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER_ID;

/**
 * Materializes a registration that happened directly against the provider.
 * <p>
 * The provider user already exists, so the first step only takes ownership of
 * it: if the local write fails, the provider user is deleted rather than left
 * without a local counterpart. The organization must already have a local
 * tenant; the user joins it as {@code org-user}.
 * </p>
 */
public class RegistrationMaterializationSaga extends AbstractProvisioningWorkflow {

    static final String NAME = "registration-reconciliation";

    private static final ContextKey<UUID> USER_ID = ContextKey.of("internalUserId", UUID.class);

    public RegistrationMaterializationSaga(WorkflowSupport support) {
        super(support);
    }

    /**
     * @return the internal id of the materialized user
     */
    public UUID materialize(RegistrationEvent event, CancellationSignal signal) {
        UnitOfWork uow = support.store().openUnitOfWork();
        TenancySaga saga = SagaBuilder.newSaga(NAME)
                .description("Materialize registration of " + event.email())
                .step(adoptProviderUser(event))
                .step(steps.persistLocally("materialize-registration", uow, USER_ID,
                        (tx, ctx) -> persist(tx, ctx, event)))
                .build();

        SagaContext context = new SagaContext(signal);
        runAudited(saga, context, FailureRecord.builder(NAME)
                .externalUserId(event.externalUserId())
                .externalOrgId(event.externalOrgId())
                .person(event.email(), event.firstName(), event.lastName()));
        return context.require(USER_ID);
    }

    private SagaStep adoptProviderUser(RegistrationEvent event) {
        return FunctionalSagaStep.builder()
                .stepId("adopt-provider-user")
                .execute(ctx -> ctx
                        .put(EXTERNAL_USER, new ExternalUser(event.externalUserId(), event.email(),
                                event.email(), event.firstName(), event.lastName()))
                        .put(EXTERNAL_USER_ID, event.externalUserId())
                        .put(EXTERNAL_ORG_ID, event.externalOrgId()))
                .compensate(ctx -> steps.deleteProviderUser(ctx.require(EXTERNAL_USER_ID)))
                .build();
    }

    private UUID persist(UnitOfWork uow, SagaContext ctx, RegistrationEvent event) {
        Instant now = support.clock().instant();
        UUID tenantId = steps.requireTenantId(uow, ctx.require(EXTERNAL_ORG_ID));
        UUID userId = steps.resolveOrStageUser(uow, ctx.require(EXTERNAL_USER), now);
        steps.stageMembership(uow, tenantId, userId, TenantRole.ORG_USER,
                event.firstName(), event.lastName(), now);
        return userId;
    }
}
