package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.identity.IdempotentDeletes;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.FunctionalSagaStep;
import com.nayem.tenancy.saga.PreconditionViolationException;
import com.nayem.tenancy.saga.SagaBuilder;
import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.saga.SagaStep;
import com.nayem.tenancy.saga.TenancySaga;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.ExternalIdentityMapping;
import com.nayem.tenancy.store.Membership;
import com.nayem.tenancy.store.Profile;
import com.nayem.tenancy.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.LOCAL_TRANSACTION_OPEN;
import static com.nayem.tenancy.workflow.ProvisioningFacts.REMOVED_FROM_ORG;

/**
 * Deactivates a member of a tenant.
 * <p>
 * The profile is marked inactive in a local transaction that stays open while
 * the user's sessions are revoked and the user is removed from the provider
 * organization; it is committed last. Revoked sessions are not restored on
 * failure.
 * </p>
 */
public class UserDeactivationSaga extends AbstractProvisioningWorkflow {

    private static final Logger log = LoggerFactory.getLogger(UserDeactivationSaga.class);

    static final String NAME = "user-deactivation";

    public UserDeactivationSaga(WorkflowSupport support) {
        super(support);
    }

    /**
     * @param tenantId Internal tenant id
     * @param userId   Internal user id
     * @throws PreconditionViolationException if the user is not a member of the tenant or has no profile
     */
    public void deactivate(UUID tenantId, UUID userId, CancellationSignal signal) {
        UnitOfWork reader = support.store().openUnitOfWork();
        Membership membership = reader.memberships().find(tenantId, userId)
                .orElseThrow(() -> new PreconditionViolationException(
                        "User " + userId + " is not a member of tenant " + tenantId));
        Profile profile = reader.profiles().findByMembership(membership.id())
                .orElseThrow(() -> new PreconditionViolationException(
                        "No profile for user " + userId + " in tenant " + tenantId));
        Optional<String> externalUserId = reader.mappings()
                .findForEntity(EntityKind.USER, userId, support.providerId())
                .map(ExternalIdentityMapping::externalId);
        Optional<String> externalOrgId = reader.mappings()
                .findForEntity(EntityKind.TENANT, tenantId, support.providerId())
                .map(ExternalIdentityMapping::externalId);
        if (externalUserId.isEmpty()) {
            log.warn("User {} has no provider identity, only deactivating locally", userId);
        }

        UnitOfWork uow = support.store().openUnitOfWork();
        TenancySaga saga = SagaBuilder.newSaga(NAME)
                .description("Deactivate user " + userId + " in tenant " + tenantId)
                .step(markInactive(uow, profile))
                .stepIf(externalUserId.isPresent(), this::revokeSessions)
                .stepIf(externalUserId.isPresent() && externalOrgId.isPresent(), this::removeFromOrganization)
                .step(commit(uow))
                .build();

        SagaContext context = new SagaContext(signal);
        externalUserId.ifPresent(id -> context.put(EXTERNAL_USER_ID, id));
        externalOrgId.ifPresent(id -> context.put(EXTERNAL_ORG_ID, id));
        runAudited(saga, context, FailureRecord.builder(NAME));
    }

    private SagaStep markInactive(UnitOfWork uow, Profile profile) {
        return FunctionalSagaStep.builder()
                .stepId("mark-inactive-locally")
                .execute(ctx -> {
                    uow.begin();
                    ctx.put(LOCAL_TRANSACTION_OPEN, true);
                    uow.profiles().update(profile.deactivated(support.clock().instant()));
                })
                .compensate(ctx -> steps.rollbackIfOpen(uow))
                .build();
    }

    private SagaStep revokeSessions() {
        return FunctionalSagaStep.builder()
                .stepId("revoke-sessions")
                .execute(ctx -> support.provider().revokeSessions(ctx.require(EXTERNAL_USER_ID), ctx.signal()))
                .build();
    }

    private SagaStep removeFromOrganization() {
        return FunctionalSagaStep.builder()
                .stepId("remove-from-organization")
                .execute(ctx -> {
                    String userId = ctx.require(EXTERNAL_USER_ID);
                    String orgId = ctx.require(EXTERNAL_ORG_ID);
                    boolean removed = IdempotentDeletes.tolerateNotFound(
                            "Remove user " + userId + " from organization " + orgId,
                            () -> support.provider().removeUserFromOrganization(userId, orgId, ctx.signal()));
                    ctx.put(REMOVED_FROM_ORG, removed);
                })
                .compensate(ctx -> {
                    if (ctx.isSet(REMOVED_FROM_ORG)) {
                        support.provider().addUserToOrganization(
                                ctx.require(EXTERNAL_USER_ID), ctx.require(EXTERNAL_ORG_ID));
                    }
                })
                .build();
    }

    private SagaStep commit(UnitOfWork uow) {
        return FunctionalSagaStep.builder()
                .stepId("commit-locally")
                .execute(ctx -> {
                    uow.commit(ctx.signal());
                    ctx.put(LOCAL_TRANSACTION_OPEN, false);
                })
                .build();
    }
}
