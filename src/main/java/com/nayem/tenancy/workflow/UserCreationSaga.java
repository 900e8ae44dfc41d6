package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.ContextKey;
import com.nayem.tenancy.saga.SagaBuilder;
import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.saga.TenancySaga;
import com.nayem.tenancy.store.TenantRole;
import com.nayem.tenancy.store.UnitOfWork;

import java.time.Instant;
import java.util.UUID;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER;

/**
 * Creates a user, optionally as an {@code org-user} member of an existing organization.
 * The link step is only part of the saga when an organization is given.
 */
public class UserCreationSaga extends AbstractProvisioningWorkflow {

    static final String NAME = "user-creation";

    private static final ContextKey<UUID> USER_ID = ContextKey.of("internalUserId", UUID.class);

    public UserCreationSaga(WorkflowSupport support) {
        super(support);
    }

    /**
     * @param externalOrgId Provider id of the organization to join, or null
     * @return the internal id of the user
     */
    public UUID createUser(NewUserRequest request, String externalOrgId, CancellationSignal signal) {
        boolean joinsOrganization = externalOrgId != null && !externalOrgId.isBlank();
        UnitOfWork uow = support.store().openUnitOfWork();
        TenancySaga saga = SagaBuilder.newSaga(NAME)
                .description("Create user " + request.email()
                        + (joinsOrganization ? " in organization " + externalOrgId : ""))
                .step(steps.createUser(request.toExternalUser()))
                .stepIf(joinsOrganization, steps::linkUserToOrganization)
                .step(steps.persistLocally("persist-user", uow, USER_ID,
                        (tx, ctx) -> persist(tx, ctx, request, joinsOrganization)))
                .build();

        SagaContext context = new SagaContext(signal);
        if (joinsOrganization) {
            context.put(EXTERNAL_ORG_ID, externalOrgId);
        }
        runAudited(saga, context, FailureRecord.builder(NAME)
                .person(request.email(), request.firstName(), request.lastName()));
        return context.require(USER_ID);
    }

    private UUID persist(UnitOfWork uow, SagaContext ctx, NewUserRequest request, boolean joinsOrganization) {
        ExternalUser externalUser = ctx.require(EXTERNAL_USER);
        Instant now = support.clock().instant();
        UUID userId = steps.resolveOrStageUser(uow, externalUser, now);
        if (joinsOrganization) {
            UUID tenantId = steps.requireTenantId(uow, ctx.require(EXTERNAL_ORG_ID));
            steps.stageMembership(uow, tenantId, userId, TenantRole.ORG_USER,
                    request.firstName(), request.lastName(), now);
        }
        return userId;
    }
}
