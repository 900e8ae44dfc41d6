package com.nayem.tenancy.reconcile;

import com.nayem.tenancy.audit.InMemoryFailureLog;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.identity.InMemoryIdentityProvider;
import com.nayem.tenancy.identity.RegistrationEvent;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.SagaEngine;
import com.nayem.tenancy.saga.SagaMetrics;
import com.nayem.tenancy.store.InMemoryTransactionalStore;
import com.nayem.tenancy.store.TenantRole;
import com.nayem.tenancy.workflow.NewTenantRequest;
import com.nayem.tenancy.workflow.NewUserRequest;
import com.nayem.tenancy.workflow.OnboardingResult;
import com.nayem.tenancy.workflow.OnboardingSaga;
import com.nayem.tenancy.workflow.RegistrationMaterializationSaga;
import com.nayem.tenancy.workflow.WorkflowSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RegistrationReconcilerTest {

    private static final UUID PROVIDER_ID = UUID.fromString("049284c1-ff29-4f28-869f-f64300b69719");
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryIdentityProvider provider;
    private InMemoryTransactionalStore store;
    private InMemoryFailureLog failureLog;
    private SimpleMeterRegistry registry;
    private RegistrationReconciler reconciler;
    private OnboardingResult acme;

    @BeforeEach
    void setUp() {
        provider = new InMemoryIdentityProvider();
        store = new InMemoryTransactionalStore();
        failureLog = new InMemoryFailureLog();
        registry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        WorkflowSupport support = new WorkflowSupport(new SagaEngine(), provider, store, failureLog, PROVIDER_ID, clock);
        reconciler = new RegistrationReconciler(provider, store, new RegistrationMaterializationSaga(support),
                PROVIDER_ID, Duration.ofMinutes(70), clock, new SagaMetrics(registry));

        acme = new OnboardingSaga(support).onboard(
                new NewUserRequest("admin@acme.com", "Ada", "Admin", "Secret123!"),
                new NewTenantRequest("Acme", "acme.com"),
                CancellationSignal.none());
    }

    @Test
    void testMaterializesRegistrationAsOrgUser() {
        register("ext-henry", "henry@acme.com", acme.externalOrgId(), NOW.minusSeconds(300));

        ReconciliationReport report = reconciler.reconcile(CancellationSignal.none());

        assertEquals(1, report.succeeded());
        assertThat(store.committedUsers()).anyMatch(u -> u.email().equals("henry@acme.com"));
        UUID henryId = store.openUnitOfWork().mappings().find(PROVIDER_ID, "ext-henry").orElseThrow().internalId();
        assertTrue(store.openUnitOfWork().memberships().find(acme.tenantId(), henryId).orElseThrow()
                .hasRole(TenantRole.ORG_USER));
        assertEquals(1.0, registry.counter("tenancy.reconciliation.processed").count());
    }

    @Test
    void testDuplicateEventsMaterializeOnce() {
        register("ext-henry", "henry@acme.com", acme.externalOrgId(), NOW.minusSeconds(300));
        register("ext-henry", "henry@acme.com", acme.externalOrgId(), NOW.minusSeconds(200));

        ReconciliationReport report = reconciler.reconcile(CancellationSignal.none());

        assertEquals(1, report.succeeded());
        assertEquals(1, report.skipped());
        assertEquals(2, store.committedUsers().size());
    }

    @Test
    void testOverlappingWindowSkipsAlreadyMaterialized() {
        register("ext-henry", "henry@acme.com", acme.externalOrgId(), NOW.minusSeconds(300));
        reconciler.reconcile(CancellationSignal.none());

        ReconciliationReport second = reconciler.reconcile(CancellationSignal.none());

        assertEquals(0, second.succeeded());
        assertEquals(1, second.skipped());
        assertEquals(2, store.committedUsers().size());
    }

    @Test
    void testInvalidEventIsCountedAndCycleContinues() {
        provider.publishRegistration(new RegistrationEvent("ext-blank", acme.externalOrgId(), "",
                "No", "Email", NOW.minusSeconds(400)));
        register("ext-henry", "henry@acme.com", acme.externalOrgId(), NOW.minusSeconds(300));

        ReconciliationReport report = reconciler.reconcile(CancellationSignal.none());

        assertEquals(2, report.fetched());
        assertEquals(1, report.failed());
        assertEquals(1, report.succeeded());
        assertEquals(0, failureLog.size());
    }

    @Test
    void testUnknownOrganizationDeletesProviderUserAndRecordsFailure() {
        register("ext-ivan", "ivan@nowhere.io", "org-without-tenant", NOW.minusSeconds(300));

        ReconciliationReport report = reconciler.reconcile(CancellationSignal.none());

        assertEquals(1, report.failed());
        assertTrue(provider.findUserById("ext-ivan").isEmpty());
        assertEquals(1, failureLog.size());
        assertEquals("ext-ivan", failureLog.list(1).get(0).externalUserId());
        assertEquals(1, store.committedUsers().size());
    }

    @Test
    void testEventsOutsideWindowAreIgnored() {
        register("ext-old", "old@acme.com", acme.externalOrgId(), NOW.minus(Duration.ofHours(2)));

        ReconciliationReport report = reconciler.reconcile(CancellationSignal.none());

        assertEquals(0, report.fetched());
    }

    @Test
    void testCancelledCycleStopsBeforeNextEvent() {
        register("ext-henry", "henry@acme.com", acme.externalOrgId(), NOW.minusSeconds(300));
        register("ext-jane", "jane@acme.com", acme.externalOrgId(), NOW.minusSeconds(200));
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        ReconciliationReport report = reconciler.reconcile(signal);

        assertTrue(report.cancelled());
        assertEquals(2, report.unprocessed());
        assertEquals(1, store.committedUsers().size());
    }

    private void register(String externalUserId, String email, String externalOrgId, Instant at) {
        if (provider.findUserById(externalUserId).isEmpty()) {
            provider.seedUser(new ExternalUser(externalUserId, email, email, "Reg", "User"));
        }
        provider.publishRegistration(new RegistrationEvent(externalUserId, externalOrgId, email, "Reg", "User", at));
    }
}
