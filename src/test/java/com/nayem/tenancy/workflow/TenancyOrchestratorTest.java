package com.nayem.tenancy.workflow;

import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.SagaExecutionException;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.ProfileStatus;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TenancyOrchestratorTest {

    private final WorkflowFixture fixture = new WorkflowFixture();
    private final TenancyOrchestrator orchestrator = new TenancyOrchestrator(fixture.support);

    @Test
    void testTenantLifecycle() {
        OnboardingResult acme = orchestrator.onboardOrganization(
                new NewUserRequest("admin@acme.com", "Ada", "Admin", "Secret123!"),
                new NewTenantRequest("Acme", "acme.com"));

        String carolExternalId = orchestrator.inviteUserToTenant(
                new InviteUserRequest(acme.tenantId(), "carol@acme.com", "Carol", "Danvers"));
        UUID carolId = fixture.store.openUnitOfWork().mappings()
                .find(WorkflowFixture.PROVIDER_ID, carolExternalId).orElseThrow().internalId();

        orchestrator.deactivateUserInTenant(acme.tenantId(), carolId);
        assertTrue(fixture.store.committedProfiles().stream()
                .anyMatch(p -> p.status() == ProfileStatus.INACTIVE));

        orchestrator.deleteUser(carolExternalId, acme.externalUserId(), acme.externalOrgId());
        assertEquals(1, fixture.store.committedUsers().size());
        assertEquals(0, fixture.failureLog.size());
    }

    @Test
    void testCreateTenantThenUserInIt() {
        UUID tenantId = orchestrator.createTenant(new NewTenantRequest("Initech", "initech.com"));
        String externalOrgId = fixture.externalIdOf(EntityKind.TENANT, tenantId);

        UUID userId = orchestrator.createUser(
                new NewUserRequest("peter@initech.com", "Peter", "Gibbons", "pw"), externalOrgId);

        assertTrue(fixture.store.openUnitOfWork().memberships().find(tenantId, userId).isPresent());
    }

    @Test
    void testCancelledSignalRunsNoStep() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        assertThrows(SagaExecutionException.class,
                () -> orchestrator.createTenant(new NewTenantRequest("Initech", "initech.com"), signal));

        assertTrue(fixture.provider.organizations().isEmpty());
    }
}
