package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.ContextKey;
import com.nayem.tenancy.saga.SagaBuilder;
import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.saga.TenancySaga;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.ExternalIdentityMapping;
import com.nayem.tenancy.store.Membership;
import com.nayem.tenancy.store.Profile;
import com.nayem.tenancy.store.Tenant;
import com.nayem.tenancy.store.TenantRole;
import com.nayem.tenancy.store.UnitOfWork;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER;

/**
 * Creates a tenant together with its first administrator.
 * <p>
 * Provider steps run first since the provider is authoritative for identity;
 * local persistence runs last and is therefore compensated first:
 * </p>
 * <ol>
 * <li>resolve-or-create-user: reuses an existing provider account for the email</li>
 * <li>create-organization</li>
 * <li>link-user-to-organization</li>
 * <li>persist-onboarding: user, tenant, both mappings, an {@code org-admin}
 * membership and a profile, in one local transaction</li>
 * </ol>
 * A provider account the saga reused is never deleted on failure.
 */
public class OnboardingSaga extends AbstractProvisioningWorkflow {

    static final String NAME = "onboarding";

    private static final ContextKey<OnboardingResult> RESULT =
            ContextKey.of("onboardingResult", OnboardingResult.class);

    public OnboardingSaga(WorkflowSupport support) {
        super(support);
    }

    public OnboardingResult onboard(NewUserRequest user, NewTenantRequest tenant, CancellationSignal signal) {
        UnitOfWork uow = support.store().openUnitOfWork();
        TenancySaga saga = SagaBuilder.newSaga(NAME)
                .description("Onboard " + tenant.name() + " (" + tenant.domain() + ") with administrator " + user.email())
                .step(steps.resolveOrCreateUser(user.toExternalUser()))
                .step(steps.createOrganization(tenant.toOrganization()))
                .step(steps.linkUserToOrganization())
                .step(steps.persistLocally("persist-onboarding", uow, RESULT,
                        (tx, ctx) -> persist(tx, ctx, user, tenant)))
                .build();

        SagaContext context = new SagaContext(signal);
        runAudited(saga, context, FailureRecord.builder(NAME)
                .person(user.email(), user.firstName(), user.lastName()));
        return context.require(RESULT);
    }

    private OnboardingResult persist(UnitOfWork uow, SagaContext ctx, NewUserRequest request,
            NewTenantRequest tenantRequest) {
        ExternalUser externalUser = ctx.require(EXTERNAL_USER);
        String externalOrgId = ctx.require(EXTERNAL_ORG_ID);
        Instant now = support.clock().instant();

        UUID userId = steps.resolveOrStageUser(uow, externalUser, now);

        Tenant tenant = new Tenant(UUID.randomUUID(), tenantRequest.name(), List.of(tenantRequest.domain()), now);
        uow.tenants().add(tenant);
        uow.mappings().add(ExternalIdentityMapping.create(
                tenant.id(), externalOrgId, EntityKind.TENANT, support.providerId(), now));

        Membership membership = Membership.grant(tenant.id(), userId, TenantRole.ORG_ADMIN, now);
        uow.memberships().add(membership);
        uow.profiles().add(Profile.active(membership.id(), request.firstName(), request.lastName(), now));

        return new OnboardingResult(tenant.id(), userId, externalOrgId, externalUser.id());
    }
}
