package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.identity.NewExternalUser;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.ContextKey;
import com.nayem.tenancy.saga.PreconditionViolationException;
import com.nayem.tenancy.saga.SagaBuilder;
import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.saga.TenancySaga;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.ExternalIdentityMapping;
import com.nayem.tenancy.store.TenantRole;
import com.nayem.tenancy.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER;

/**
 * Invites a user into an existing tenant.
 * <p>
 * An unknown email gets a password-less provider account and a password-setup
 * email; a known email reuses the existing account, which is never deleted on
 * failure. Local writes are idempotent: an existing user mapping or membership
 * is reused.
 * </p>
 */
public class UserInvitationSaga extends AbstractProvisioningWorkflow {

    private static final Logger log = LoggerFactory.getLogger(UserInvitationSaga.class);

    static final String NAME = "user-invitation";

    private static final ContextKey<UUID> USER_ID = ContextKey.of("internalUserId", UUID.class);

    public UserInvitationSaga(WorkflowSupport support) {
        super(support);
    }

    /**
     * @return the provider id of the invited user
     * @throws PreconditionViolationException if the tenant is unknown or has no provider organization
     */
    public String invite(InviteUserRequest request, CancellationSignal signal) {
        String externalOrgId = support.store().openUnitOfWork().mappings()
                .findForEntity(EntityKind.TENANT, request.tenantId(), support.providerId())
                .map(ExternalIdentityMapping::externalId)
                .orElseThrow(() -> {
                    log.warn("Invitation of {} rejected: tenant {} has no provider organization",
                            request.email(), request.tenantId());
                    return new PreconditionViolationException(
                            "Could not find provider organization for tenant " + request.tenantId());
                });

        UnitOfWork uow = support.store().openUnitOfWork();
        TenancySaga saga = SagaBuilder.newSaga(NAME)
                .description("Invite " + request.email() + " to tenant " + request.tenantId())
                .step(steps.resolveOrCreateUser(
                        NewExternalUser.invitation(request.email(), request.firstName(), request.lastName())))
                .step(steps.sendPasswordSetupEmail())
                .step(steps.linkUserToOrganization())
                .step(steps.persistLocally("persist-invited-user", uow, USER_ID,
                        (tx, ctx) -> persist(tx, ctx, request)))
                .build();

        SagaContext context = new SagaContext(signal).put(EXTERNAL_ORG_ID, externalOrgId);
        runAudited(saga, context, FailureRecord.builder(NAME)
                .person(request.email(), request.firstName(), request.lastName()));
        return context.require(EXTERNAL_USER).id();
    }

    private UUID persist(UnitOfWork uow, SagaContext ctx, InviteUserRequest request) {
        ExternalUser externalUser = ctx.require(EXTERNAL_USER);
        Instant now = support.clock().instant();
        UUID userId = steps.resolveOrStageUser(uow, externalUser, now);
        steps.stageMembership(uow, request.tenantId(), userId, TenantRole.ORG_USER,
                request.firstName(), request.lastName(), now);
        return userId;
    }
}
