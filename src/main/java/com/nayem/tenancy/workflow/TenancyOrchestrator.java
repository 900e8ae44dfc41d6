package com.nayem.tenancy.workflow;

import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.PreconditionViolationException;
import com.nayem.tenancy.saga.SagaExecutionException;

import java.util.UUID;

/**
 * Entry point for the provisioning workflows.
 * <p>
 * Every operation either completes or throws. {@link PreconditionViolationException}
 * means nothing was touched. {@link SagaExecutionException} means a step failed
 * and compensation was attempted; its cause is the original failure. A failure
 * does not imply nothing was created, since compensation is best-effort: the
 * failure log is authoritative.
 * </p>
 */
public class TenancyOrchestrator {

    private final OnboardingSaga onboarding;
    private final TenantCreationSaga tenantCreation;
    private final UserCreationSaga userCreation;
    private final UserInvitationSaga userInvitation;
    private final UserDeletionSaga userDeletion;
    private final UserDeactivationSaga userDeactivation;

    public TenancyOrchestrator(WorkflowSupport support) {
        this.onboarding = new OnboardingSaga(support);
        this.tenantCreation = new TenantCreationSaga(support);
        this.userCreation = new UserCreationSaga(support);
        this.userInvitation = new UserInvitationSaga(support);
        this.userDeletion = new UserDeletionSaga(support);
        this.userDeactivation = new UserDeactivationSaga(support);
    }

    public OnboardingResult onboardOrganization(NewUserRequest user, NewTenantRequest tenant) {
        return onboardOrganization(user, tenant, CancellationSignal.none());
    }

    public OnboardingResult onboardOrganization(NewUserRequest user, NewTenantRequest tenant,
            CancellationSignal signal) {
        return onboarding.onboard(user, tenant, signal);
    }

    public UUID createTenant(NewTenantRequest tenant) {
        return createTenant(tenant, CancellationSignal.none());
    }

    public UUID createTenant(NewTenantRequest tenant, CancellationSignal signal) {
        return tenantCreation.createTenant(tenant, signal);
    }

    /**
     * @param externalOrgId Provider organization to join, or null
     */
    public UUID createUser(NewUserRequest user, String externalOrgId) {
        return createUser(user, externalOrgId, CancellationSignal.none());
    }

    public UUID createUser(NewUserRequest user, String externalOrgId, CancellationSignal signal) {
        return userCreation.createUser(user, externalOrgId, signal);
    }

    public String inviteUserToTenant(InviteUserRequest invitation) {
        return inviteUserToTenant(invitation, CancellationSignal.none());
    }

    public String inviteUserToTenant(InviteUserRequest invitation, CancellationSignal signal) {
        return userInvitation.invite(invitation, signal);
    }

    public void deleteUser(String externalUserId, String actorExternalId, String externalTenantId) {
        deleteUser(externalUserId, actorExternalId, externalTenantId, CancellationSignal.none());
    }

    public void deleteUser(String externalUserId, String actorExternalId, String externalTenantId,
            CancellationSignal signal) {
        userDeletion.deleteUser(externalUserId, actorExternalId, externalTenantId, signal);
    }

    public void deactivateUserInTenant(UUID tenantId, UUID userId) {
        deactivateUserInTenant(tenantId, userId, CancellationSignal.none());
    }

    public void deactivateUserInTenant(UUID tenantId, UUID userId, CancellationSignal signal) {
        userDeactivation.deactivate(tenantId, userId, signal);
    }
}
