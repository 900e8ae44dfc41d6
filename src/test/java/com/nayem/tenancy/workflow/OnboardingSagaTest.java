package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.identity.IdentityProviderException;
import com.nayem.tenancy.identity.NewOrganization;
import com.nayem.tenancy.identity.ProviderResourceNotFoundException;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.SagaExecutionException;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.Membership;
import com.nayem.tenancy.store.StoreException;
import com.nayem.tenancy.store.Tenant;
import com.nayem.tenancy.store.TenantRole;
import com.nayem.tenancy.store.UnitOfWork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class OnboardingSagaTest {

    private WorkflowFixture fixture;
    private OnboardingSaga saga;

    @BeforeEach
    void setUp() {
        fixture = new WorkflowFixture();
        saga = new OnboardingSaga(fixture.support);
    }

    private OnboardingResult onboardAcme() {
        return saga.onboard(
                new NewUserRequest("admin@acme.com", "Ada", "Admin", "Secret123!"),
                new NewTenantRequest("Acme", "acme.com"),
                CancellationSignal.none());
    }

    @Test
    void testSuccessfulOnboardingPersistsEverything() {
        OnboardingResult result = onboardAcme();

        assertEquals(1, fixture.store.committedUsers().size());
        assertEquals(1, fixture.store.committedTenants().size());
        assertEquals(2, fixture.store.committedMappings().size());
        assertEquals(1, fixture.store.committedProfiles().size());

        List<Membership> memberships = fixture.store.committedMemberships();
        assertEquals(1, memberships.size());
        assertTrue(memberships.get(0).hasRole(TenantRole.ORG_ADMIN));
        assertEquals(result.tenantId(), memberships.get(0).tenantId());
        assertEquals(result.userId(), memberships.get(0).userId());

        Tenant tenant = fixture.store.committedTenants().get(0);
        assertEquals("acme.com", tenant.primaryDomain());
        assertEquals(result.externalOrgId(), fixture.externalIdOf(EntityKind.TENANT, result.tenantId()));
        assertEquals(result.externalUserId(), fixture.externalIdOf(EntityKind.USER, result.userId()));
        assertNotEquals(result.externalUserId(), result.userId().toString());

        assertTrue(fixture.provider.isMember(result.externalUserId(), result.externalOrgId()));
        assertEquals(0, fixture.failureLog.size());
    }

    @Test
    void testOrganizationFailureDeletesNewlyCreatedUser() {
        fixture.provider.createOrganization(new NewOrganization("Someone Else", "acme.com"));

        SagaExecutionException thrown = assertThrows(SagaExecutionException.class, this::onboardAcme);

        assertEquals("create-organization", thrown.getFailedStepId());
        assertThat(thrown.getCause()).isInstanceOf(IdentityProviderException.class);
        assertTrue(fixture.provider.findUserByEmail("admin@acme.com").isEmpty());
        assertTrue(fixture.store.committedUsers().isEmpty());
        assertTrue(fixture.store.committedTenants().isEmpty());

        FailureRecord record = fixture.failureLog.list(10).get(0);
        assertEquals("onboarding", record.workflow());
        assertEquals("admin@acme.com", record.email());
        assertTrue(record.compensationSucceeded());
        assertNotNull(record.externalUserId());
    }

    @Test
    void testPreExistingUserIsNeverDeleted() {
        ExternalUser existing = fixture.provider.seedUser(
                new ExternalUser("kc-existing", "admin@acme.com", "admin@acme.com", "Ada", "Admin"));
        fixture.provider.createOrganization(new NewOrganization("Someone Else", "acme.com"));

        assertThrows(SagaExecutionException.class, this::onboardAcme);

        verify(fixture.provider, never()).deleteUser(anyString(), any());
        assertTrue(fixture.provider.findUserById(existing.id()).isPresent());
    }

    @Test
    void testLocalCommitFailureUndoesProviderStepsInReverse() {
        UnitOfWork seed = fixture.store.openUnitOfWork();
        seed.begin();
        seed.tenants().add(new Tenant(UUID.randomUUID(), "Local Acme", List.of("acme.com"), WorkflowFixture.NOW));
        seed.commit();

        SagaExecutionException thrown = assertThrows(SagaExecutionException.class, this::onboardAcme);

        assertEquals("persist-onboarding", thrown.getFailedStepId());
        assertThat(thrown.getCause()).isInstanceOf(StoreException.class);
        assertEquals(1, fixture.store.committedTenants().size());
        assertTrue(fixture.store.committedUsers().isEmpty());
        assertTrue(fixture.store.committedMappings().isEmpty());

        InOrder order = inOrder(fixture.provider);
        order.verify(fixture.provider).removeUserFromOrganization(anyString(), anyString(), any());
        order.verify(fixture.provider).deleteOrganization(anyString(), any());
        order.verify(fixture.provider).deleteUser(anyString(), any());
        assertTrue(fixture.provider.organizations().isEmpty());
        assertTrue(fixture.provider.users().isEmpty());
    }

    @Test
    void testLinkFailureCompensatesOrganizationAndUser() {
        doThrow(new IdentityProviderException(503, "provider unavailable"))
                .when(fixture.provider).addUserToOrganization(anyString(), anyString(), any());

        SagaExecutionException thrown = assertThrows(SagaExecutionException.class, this::onboardAcme);

        assertEquals("link-user-to-organization", thrown.getFailedStepId());
        verify(fixture.provider, never()).removeUserFromOrganization(anyString(), anyString(), any());
        assertTrue(fixture.provider.organizations().isEmpty());
        assertTrue(fixture.provider.users().isEmpty());
    }

    @Test
    void testAlreadyDeletedOrganizationCountsAsCompensated() {
        doThrow(new ProviderResourceNotFoundException("organization already gone"))
                .when(fixture.provider).deleteOrganization(anyString(), any());
        doThrow(new IdentityProviderException(503, "provider unavailable"))
                .when(fixture.provider).addUserToOrganization(anyString(), anyString(), any());

        SagaExecutionException thrown = assertThrows(SagaExecutionException.class, this::onboardAcme);

        assertTrue(thrown.getResult().compensationSucceeded());
        assertTrue(fixture.failureLog.list(1).get(0).compensationSucceeded());
    }

    @Test
    void testCompensationFailureDoesNotStopEarlierCompensations() {
        doThrow(new IdentityProviderException(500, "delete organization failed"))
                .when(fixture.provider).deleteOrganization(anyString(), any());
        doThrow(new IdentityProviderException(503, "provider unavailable"))
                .when(fixture.provider).addUserToOrganization(anyString(), anyString(), any());

        SagaExecutionException thrown = assertThrows(SagaExecutionException.class, this::onboardAcme);

        assertThat(thrown.getCause()).hasMessage("provider unavailable");
        assertEquals(1, thrown.getSuppressed().length);
        assertTrue(fixture.provider.users().isEmpty(), "user still deleted after org compensation failed");

        FailureRecord record = fixture.failureLog.list(1).get(0);
        assertFalse(record.compensationSucceeded());
        assertEquals("provider unavailable", record.errorMessage());
    }

    @Test
    void testDeadlineExpiringInsideProviderCallAbortsTheCall() {
        CancellationSignal signal = CancellationSignal.withDeadline(
                Instant.now().plusMillis(300), Clock.systemUTC());
        doAnswer(invocation -> {
            CancellationSignal passed = invocation.getArgument(1);
            Instant giveUp = Instant.now().plusSeconds(5);
            while (!passed.isCancelled() && Instant.now().isBefore(giveUp)) {
                Thread.sleep(10);
            }
            passed.throwIfCancelled();
            return null;
        }).when(fixture.provider).createOrganization(any(), any());

        SagaExecutionException thrown = assertThrows(SagaExecutionException.class, () -> saga.onboard(
                new NewUserRequest("admin@acme.com", "Ada", "Admin", "Secret123!"),
                new NewTenantRequest("Acme", "acme.com"),
                signal));

        assertEquals("create-organization", thrown.getFailedStepId());
        assertThat(thrown.getCause()).isInstanceOf(CancellationException.class);
        verify(fixture.provider).deleteUser(anyString(), eq(CancellationSignal.none()));
        assertTrue(fixture.provider.users().isEmpty());
        assertTrue(fixture.store.committedUsers().isEmpty());
    }

    @Test
    void testExistingLocalUserIsReusedForSecondTenant() {
        OnboardingResult first = onboardAcme();

        OnboardingResult second = saga.onboard(
                new NewUserRequest("admin@acme.com", "Ada", "Admin", "Secret123!"),
                new NewTenantRequest("Acme Labs", "labs.acme.com"),
                CancellationSignal.none());

        assertEquals(first.userId(), second.userId());
        assertEquals(first.externalUserId(), second.externalUserId());
        assertEquals(1, fixture.store.committedUsers().size());
        assertEquals(2, fixture.store.committedTenants().size());
        assertEquals(3, fixture.store.committedMappings().size());
    }

    @Test
    void testCancelledBeforeStartTouchesNothing() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        assertThrows(SagaExecutionException.class, () -> saga.onboard(
                new NewUserRequest("admin@acme.com", "Ada", "Admin", "Secret123!"),
                new NewTenantRequest("Acme", "acme.com"),
                signal));

        assertTrue(fixture.provider.users().isEmpty());
        assertEquals(0, fixture.failureLog.size());
    }
}
