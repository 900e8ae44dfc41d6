package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.identity.IdempotentDeletes;
import com.nayem.tenancy.identity.NewExternalUser;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.ContextKey;
import com.nayem.tenancy.saga.FunctionalSagaStep;
import com.nayem.tenancy.saga.PreconditionViolationException;
import com.nayem.tenancy.saga.SagaBuilder;
import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.saga.SagaStep;
import com.nayem.tenancy.saga.TenancySaga;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.ExternalIdentityMapping;
import com.nayem.tenancy.store.Membership;
import com.nayem.tenancy.store.TenantRole;
import com.nayem.tenancy.store.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.PROVIDER_USER_DELETED;
import static com.nayem.tenancy.workflow.ProvisioningFacts.RESTORED_EXTERNAL_USER_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.USER_SNAPSHOT;

/**
 * Deletes a user from the provider and the local store.
 * <p>
 * Business rules are checked before anything is touched and reject the call
 * with {@link PreconditionViolationException}: no self-deletion, the target
 * must belong to the caller's tenant, and the tenant's last administrator
 * cannot be deleted.
 * </p>
 * <p>
 * A provider deletion cannot be undone. If the local deletion fails afterwards
 * the user is re-created from a snapshot taken before the delete, with a new
 * provider id and a forced credential reset. That restore is reported at ERROR
 * for operators and is never retried automatically.
 * </p>
 */
public class UserDeletionSaga extends AbstractProvisioningWorkflow {

    private static final Logger log = LoggerFactory.getLogger(UserDeletionSaga.class);

    static final String NAME = "user-deletion";

    private static final ContextKey<Boolean> LOCAL_DELETED = ContextKey.of("localUserDeleted", Boolean.class);

    public UserDeletionSaga(WorkflowSupport support) {
        super(support);
    }

    /**
     * @param externalUserId   Provider id of the user to delete
     * @param actorExternalId  Provider id of the user asking for the deletion
     * @param externalTenantId Provider id of the actor's organization
     */
    public void deleteUser(String externalUserId, String actorExternalId, String externalTenantId,
            CancellationSignal signal) {
        log.info("User deletion of {} requested by {} in organization {}",
                externalUserId, actorExternalId, externalTenantId);
        Target target = checkPreconditions(externalUserId, actorExternalId, externalTenantId);

        UnitOfWork uow = support.store().openUnitOfWork();
        TenancySaga saga = SagaBuilder.newSaga(NAME)
                .description("Delete user " + externalUserId + " from organization " + externalTenantId)
                .step(captureSnapshot())
                .step(deleteFromProvider())
                .step(steps.persistLocally("delete-user-locally", uow, LOCAL_DELETED,
                        (tx, ctx) -> deleteLocally(tx, target)))
                .build();

        SagaContext context = new SagaContext(signal)
                .put(EXTERNAL_USER_ID, externalUserId)
                .put(EXTERNAL_ORG_ID, externalTenantId);
        runAudited(saga, context, FailureRecord.builder(NAME).externalUserId(externalUserId));
    }

    private Target checkPreconditions(String externalUserId, String actorExternalId, String externalTenantId) {
        if (externalUserId.equals(actorExternalId)) {
            log.warn("User {} attempted to delete themselves", actorExternalId);
            throw new PreconditionViolationException(
                    "You cannot delete your own account. Please contact another administrator.");
        }
        UnitOfWork reader = support.store().openUnitOfWork();
        UUID tenantId = reader.mappings().find(support.providerId(), externalTenantId)
                .filter(m -> m.entityKind() == EntityKind.TENANT)
                .map(ExternalIdentityMapping::internalId)
                .orElseThrow(() -> new PreconditionViolationException("Tenant not found"));
        ExternalIdentityMapping userMapping = reader.mappings().find(support.providerId(), externalUserId)
                .filter(m -> m.entityKind() == EntityKind.USER)
                .orElseThrow(() -> new PreconditionViolationException("User not found"));
        Membership membership = reader.memberships().find(tenantId, userMapping.internalId())
                .orElseThrow(() -> {
                    log.warn("User {} attempted to delete {} who does not belong to tenant {}",
                            actorExternalId, externalUserId, externalTenantId);
                    return new PreconditionViolationException("You can only delete users within your organization");
                });
        if (membership.hasRole(TenantRole.ORG_ADMIN)
                && reader.memberships().countWithRole(tenantId, TenantRole.ORG_ADMIN) <= 1) {
            log.warn("Attempted to delete the last administrator {} of tenant {}", externalUserId, externalTenantId);
            throw new PreconditionViolationException(
                    "Cannot delete the last administrator in the organization. Assign another administrator first.");
        }
        return new Target(userMapping.internalId(), userMapping.id());
    }

    private SagaStep captureSnapshot() {
        return FunctionalSagaStep.builder()
                .stepId("capture-provider-user-snapshot")
                .execute(ctx -> {
                    Optional<ExternalUser> snapshot = support.provider().findUserById(ctx.require(EXTERNAL_USER_ID), ctx.signal());
                    if (snapshot.isPresent()) {
                        ctx.put(USER_SNAPSHOT, snapshot.get());
                    } else {
                        log.warn("User {} is already absent from the provider, nothing to snapshot",
                                ctx.require(EXTERNAL_USER_ID));
                    }
                })
                .build();
    }

    private SagaStep deleteFromProvider() {
        return FunctionalSagaStep.builder()
                .stepId("delete-provider-user")
                .execute(ctx -> {
                    String userId = ctx.require(EXTERNAL_USER_ID);
                    boolean deleted = IdempotentDeletes.tolerateNotFound("Delete provider user " + userId,
                            () -> support.provider().deleteUser(userId, ctx.signal()));
                    ctx.put(PROVIDER_USER_DELETED, deleted);
                })
                .compensate(this::restoreProviderUser)
                .build();
    }

    private void restoreProviderUser(SagaContext ctx) {
        if (!ctx.isSet(PROVIDER_USER_DELETED)) {
            return;
        }
        String deletedId = ctx.require(EXTERNAL_USER_ID);
        Optional<ExternalUser> snapshot = ctx.get(USER_SNAPSHOT);
        if (snapshot.isEmpty()) {
            log.error("Provider user {} was deleted but no snapshot exists; it cannot be restored", deletedId);
            throw new IllegalStateException("No snapshot to restore provider user " + deletedId);
        }
        ExternalUser restored = support.provider().createUser(NewExternalUser.restoreFrom(snapshot.get()));
        ctx.put(RESTORED_EXTERNAL_USER_ID, restored.id());
        String orgId = ctx.require(EXTERNAL_ORG_ID);
        support.provider().addUserToOrganization(restored.id(), orgId);
        log.error("Provider user {} ({}) was restored as {} and must reset credentials. "
                        + "Local mappings still reference {}; operator action required",
                deletedId, snapshot.get().email(), restored.id(), deletedId);
    }

    private Boolean deleteLocally(UnitOfWork uow, Target target) {
        for (Membership membership : uow.memberships().deleteForUser(target.userId())) {
            uow.profiles().deleteByMembership(membership.id());
        }
        uow.mappings().delete(target.mappingId());
        uow.users().delete(target.userId());
        return Boolean.TRUE;
    }

    private record Target(UUID userId, UUID mappingId) {
    }
}
