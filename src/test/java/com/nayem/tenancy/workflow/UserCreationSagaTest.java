package com.nayem.tenancy.workflow;

import com.nayem.tenancy.identity.NewOrganization;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.SagaExecutionException;
import com.nayem.tenancy.store.EntityKind;
import com.nayem.tenancy.store.Membership;
import com.nayem.tenancy.store.TenantRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class UserCreationSagaTest {

    private WorkflowFixture fixture;
    private UserCreationSaga saga;

    @BeforeEach
    void setUp() {
        fixture = new WorkflowFixture();
        saga = new UserCreationSaga(fixture.support);
    }

    @Test
    void testCreatesStandaloneUserWithoutLinking() {
        UUID userId = saga.createUser(new NewUserRequest("solo@example.com", "Solo", "User", "pw"),
                null, CancellationSignal.none());

        assertEquals(userId, fixture.store.committedUsers().get(0).id());
        assertEquals(1, fixture.store.committedMappings().size());
        assertTrue(fixture.store.committedMemberships().isEmpty());
        verify(fixture.provider, never()).addUserToOrganization(anyString(), anyString(), any());
    }

    @Test
    void testCreatesUserInOrganizationAsOrgUser() {
        OnboardingResult acme = fixture.onboard("admin@acme.com", "Acme", "acme.com");

        UUID userId = saga.createUser(new NewUserRequest("bob@acme.com", "Bob", "Builder", "pw"),
                acme.externalOrgId(), CancellationSignal.none());

        Membership membership = fixture.store.openUnitOfWork().memberships().find(acme.tenantId(), userId).orElseThrow();
        assertTrue(membership.hasRole(TenantRole.ORG_USER));
        assertFalse(membership.hasRole(TenantRole.ORG_ADMIN));
        String externalUserId = fixture.externalIdOf(EntityKind.USER, userId);
        assertTrue(fixture.provider.isMember(externalUserId, acme.externalOrgId()));
    }

    @Test
    void testUnknownLocalOrganizationRollsBackProviderUserAndLink() {
        fixture.provider.createOrganization(new NewOrganization("Ghost", "ghost.io"));
        String ghostOrgId = fixture.provider.findOrganizationByDomain("ghost.io").id();

        SagaExecutionException thrown = assertThrows(SagaExecutionException.class,
                () -> saga.createUser(new NewUserRequest("casper@ghost.io", "Casper", "Ghost", "pw"),
                        ghostOrgId, CancellationSignal.none()));

        assertEquals("persist-user", thrown.getFailedStepId());
        assertThat(thrown.getCause()).isInstanceOf(IllegalStateException.class);
        verify(fixture.provider).removeUserFromOrganization(anyString(), anyString(), any());
        assertTrue(fixture.provider.findUserByEmail("casper@ghost.io").isEmpty());
        assertTrue(fixture.store.committedUsers().isEmpty());
    }

    @Test
    void testDuplicateEmailFailsWithoutSideEffects() {
        saga.createUser(new NewUserRequest("dup@example.com", "A", "B", "pw"), null, CancellationSignal.none());

        SagaExecutionException thrown = assertThrows(SagaExecutionException.class,
                () -> saga.createUser(new NewUserRequest("dup@example.com", "A", "B", "pw"), null,
                        CancellationSignal.none()));

        assertEquals("create-user", thrown.getFailedStepId());
        assertEquals(1, fixture.provider.users().size());
        assertEquals(0, fixture.failureLog.size());
    }

    @Test
    void testPasswordlessUserMustSetCredentials() {
        saga.createUser(new NewUserRequest("invitee@example.com", "In", "Vitee", null), null, CancellationSignal.none());

        String externalId = fixture.provider.findUserByEmail("invitee@example.com").orElseThrow().id();
        assertTrue(fixture.provider.requiresCredentialReset(externalId));
    }
}
