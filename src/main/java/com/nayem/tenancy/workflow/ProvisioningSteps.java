package com.nayem.tenancy.workflow;

import com.nayem.tenancy.identity.ExternalOrganization;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.identity.IdempotentDeletes;
import com.nayem.tenancy.identity.IdentityProviderClient;
import com.nayem.tenancy.identity.IdentityProviderException;
import com.nayem.tenancy.identity.NewExternalUser;
import com.nayem.tenancy.identity.NewOrganization;
import com.nayem.tenancy.saga.ContextKey;
import com.nayem.tenancy.saga.FunctionalSagaStep;
import com.nayem.tenancy.saga.SagaStep;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.ExternalIdentityMapping;
import com.nayem.tenancy.store.Membership;
import com.nayem.tenancy.store.Profile;
import com.nayem.tenancy.store.TenantRole;
import com.nayem.tenancy.store.UnitOfWork;
import com.nayem.tenancy.store.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.LINK_CREATED;
import static com.nayem.tenancy.workflow.ProvisioningFacts.LOCAL_TRANSACTION_OPEN;
import static com.nayem.tenancy.workflow.ProvisioningFacts.USER_WAS_CREATED;

/**
 * Steps shared by the provisioning sagas.
 * <p>
 * Every provider delete or unlink issued from a compensation tolerates
 * "not found".
 * </p>
 */
final class ProvisioningSteps {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningSteps.class);

    private final WorkflowSupport support;

    ProvisioningSteps(WorkflowSupport support) {
        this.support = support;
    }

    private IdentityProviderClient provider() {
        return support.provider();
    }

    /**
     * Reuse the provider user with the request's email, or create one. Only a
     * user this step created is ever deleted on compensation.
     */
    SagaStep resolveOrCreateUser(NewExternalUser newUser) {
        return FunctionalSagaStep.builder()
                .stepId("resolve-or-create-user")
                .execute(ctx -> {
                    Optional<ExternalUser> existing = provider().findUserByEmail(newUser.email(), ctx.signal());
                    ExternalUser user;
                    boolean created;
                    if (existing.isPresent()) {
                        user = existing.get();
                        created = false;
                        log.info("User {} already exists in provider as {}, reusing it", newUser.email(), user.id());
                    } else {
                        user = provider().createUser(newUser, ctx.signal());
                        created = true;
                        log.info("Created provider user {} for {}", user.id(), newUser.email());
                    }
                    ctx.put(EXTERNAL_USER, user)
                            .put(EXTERNAL_USER_ID, user.id())
                            .put(USER_WAS_CREATED, created);
                })
                .compensate(ctx -> {
                    String userId = ctx.require(EXTERNAL_USER_ID);
                    if (ctx.isSet(USER_WAS_CREATED)) {
                        deleteProviderUser(userId);
                    } else {
                        log.info("Keeping pre-existing provider user {}", userId);
                    }
                })
                .build();
    }

    /**
     * Always creates a new provider user; fails if the email is taken.
     */
    SagaStep createUser(NewExternalUser newUser) {
        return FunctionalSagaStep.builder()
                .stepId("create-user")
                .execute(ctx -> {
                    ExternalUser user = provider().createUser(newUser, ctx.signal());
                    log.info("Created provider user {} for {}", user.id(), newUser.email());
                    ctx.put(EXTERNAL_USER, user)
                            .put(EXTERNAL_USER_ID, user.id())
                            .put(USER_WAS_CREATED, true);
                })
                .compensate(ctx -> deleteProviderUser(ctx.require(EXTERNAL_USER_ID)))
                .build();
    }

    /**
     * Emails a password-setup link, but only to a user this saga created.
     * An email cannot be unsent, so there is no compensation.
     */
    SagaStep sendPasswordSetupEmail() {
        return FunctionalSagaStep.builder()
                .stepId("send-password-setup-email")
                .execute(ctx -> {
                    if (ctx.isSet(USER_WAS_CREATED)) {
                        provider().sendPasswordSetupEmail(ctx.require(EXTERNAL_USER_ID), ctx.signal());
                    }
                })
                .build();
    }

    /**
     * Create the organization, then re-fetch it by domain for its canonical id.
     */
    SagaStep createOrganization(NewOrganization organization) {
        return FunctionalSagaStep.builder()
                .stepId("create-organization")
                .execute(ctx -> {
                    provider().createOrganization(organization, ctx.signal());
                    ExternalOrganization created = provider().findOrganizationByDomain(organization.domain(), ctx.signal());
                    log.info("Created provider organization {} for domain {}", created.id(), organization.domain());
                    ctx.put(EXTERNAL_ORG, created).put(EXTERNAL_ORG_ID, created.id());
                })
                .compensate(ctx -> {
                    String orgId = ctx.require(EXTERNAL_ORG_ID);
                    IdempotentDeletes.tolerateNotFound("Delete organization " + orgId,
                            () -> provider().deleteOrganization(orgId));
                })
                .build();
    }

    /**
     * Add the user to the organization. A membership that already existed is
     * left in place on compensation; only a link this step created is removed.
     */
    SagaStep linkUserToOrganization() {
        return FunctionalSagaStep.builder()
                .stepId("link-user-to-organization")
                .execute(ctx -> {
                    String userId = ctx.require(EXTERNAL_USER_ID);
                    String orgId = ctx.require(EXTERNAL_ORG_ID);
                    boolean created;
                    try {
                        provider().addUserToOrganization(userId, orgId, ctx.signal());
                        created = true;
                    } catch (IdentityProviderException e) {
                        if (e.getStatus() != 409) {
                            throw e;
                        }
                        log.info("User {} is already a member of organization {}", userId, orgId);
                        created = false;
                    }
                    ctx.put(LINK_CREATED, created);
                })
                .compensate(ctx -> {
                    if (!ctx.isSet(LINK_CREATED)) {
                        return;
                    }
                    String userId = ctx.require(EXTERNAL_USER_ID);
                    String orgId = ctx.require(EXTERNAL_ORG_ID);
                    IdempotentDeletes.tolerateNotFound("Unlink user " + userId + " from organization " + orgId,
                            () -> provider().removeUserFromOrganization(userId, orgId));
                })
                .build();
    }

    /**
     * Open a transaction, stage writes, commit, then record the staged result
     * under {@code resultKey}. A failing write or commit rolls the transaction
     * back before the error propagates.
     */
    <R> SagaStep persistLocally(String stepId, UnitOfWork uow, ContextKey<R> resultKey, LocalWrite<R> write) {
        return FunctionalSagaStep.builder()
                .stepId(stepId)
                .execute(ctx -> {
                    uow.begin();
                    ctx.put(LOCAL_TRANSACTION_OPEN, true);
                    R result;
                    try {
                        result = write.stage(uow, ctx);
                        uow.commit(ctx.signal());
                    } catch (Exception e) {
                        uow.rollback();
                        throw e;
                    } finally {
                        ctx.put(LOCAL_TRANSACTION_OPEN, uow.isActive());
                    }
                    ctx.put(resultKey, result);
                })
                .compensate(ctx -> rollbackIfOpen(uow))
                .build();
    }

    void rollbackIfOpen(UnitOfWork uow) {
        if (uow.isActive()) {
            log.warn("Rolling back open local transaction");
            uow.rollback();
        }
    }

    void deleteProviderUser(String externalUserId) {
        IdempotentDeletes.tolerateNotFound("Delete provider user " + externalUserId,
                () -> provider().deleteUser(externalUserId));
    }

    /**
     * Find the local user mapped to a provider user, or stage a new one with its mapping.
     */
    UUID resolveOrStageUser(UnitOfWork uow, ExternalUser externalUser, Instant now) {
        return uow.mappings().find(support.providerId(), externalUser.id())
                .map(ExternalIdentityMapping::internalId)
                .orElseGet(() -> {
                    User user = new User(UUID.randomUUID(), externalUser.email(), now);
                    uow.users().add(user);
                    uow.mappings().add(ExternalIdentityMapping.create(
                            user.id(), externalUser.id(), EntityKind.USER, support.providerId(), now));
                    return user.id();
                });
    }

    /**
     * Resolve the local tenant of a provider organization.
     *
     * @throws IllegalStateException if the organization was never materialized locally
     */
    UUID requireTenantId(UnitOfWork uow, String externalOrgId) {
        return uow.mappings().find(support.providerId(), externalOrgId)
                .filter(mapping -> mapping.entityKind() == EntityKind.TENANT)
                .map(ExternalIdentityMapping::internalId)
                .orElseThrow(() -> new IllegalStateException(
                        "Organization " + externalOrgId + " has no local tenant"));
    }

    /**
     * Stage a membership with an active profile unless the user already belongs to the tenant.
     */
    Membership stageMembership(UnitOfWork uow, UUID tenantId, UUID userId, TenantRole role,
            String firstName, String lastName, Instant now) {
        return uow.memberships().find(tenantId, userId).orElseGet(() -> {
            Membership membership = Membership.grant(tenantId, userId, role, now);
            uow.memberships().add(membership);
            uow.profiles().add(Profile.active(membership.id(), firstName, lastName, now));
            return membership;
        });
    }
}
