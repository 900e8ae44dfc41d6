package com.nayem.tenancy.spring;

import com.nayem.tenancy.audit.FailureLog;
import com.nayem.tenancy.audit.InMemoryFailureLog;
import com.nayem.tenancy.identity.IdentityProviderClient;
import com.nayem.tenancy.identity.InMemoryIdentityProvider;
import com.nayem.tenancy.reconcile.NoOpReconciliationLock;
import com.nayem.tenancy.reconcile.ReconciliationLock;
import com.nayem.tenancy.reconcile.ReconciliationScheduler;
import com.nayem.tenancy.reconcile.RegistrationReconciler;
import com.nayem.tenancy.saga.SagaEngine;
import com.nayem.tenancy.store.InMemoryTransactionalStore;
import com.nayem.tenancy.store.TransactionalStore;
import com.nayem.tenancy.workflow.NewTenantRequest;
import com.nayem.tenancy.workflow.NewUserRequest;
import com.nayem.tenancy.workflow.OnboardingResult;
import com.nayem.tenancy.workflow.TenancyOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class TenancyAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TenancyAutoConfiguration.class));

    @Test
    void shouldBackOffWithoutProviderAndStore() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).doesNotHaveBean(TenancyOrchestrator.class);
            assertThat(context).doesNotHaveBean(SagaEngine.class);
        });
    }

    @Test
    void shouldWireWorkflowsAroundProviderAndStore() {
        contextRunner
                .withBean(IdentityProviderClient.class, InMemoryIdentityProvider::new)
                .withBean(TransactionalStore.class, InMemoryTransactionalStore::new)
                .withPropertyValues("tenancy.reconciliation.initial-delay=60")
                .run(context -> {
                    assertThat(context).hasSingleBean(TenancyOrchestrator.class);
                    assertThat(context).hasSingleBean(RegistrationReconciler.class);
                    assertThat(context).hasSingleBean(ReconciliationScheduler.class);
                    assertThat(context.getBean(FailureLog.class)).isInstanceOf(InMemoryFailureLog.class);
                    assertThat(context.getBean(ReconciliationLock.class)).isInstanceOf(NoOpReconciliationLock.class);

                    OnboardingResult result = context.getBean(TenancyOrchestrator.class).onboardOrganization(
                            new NewUserRequest("admin@acme.com", "Ada", "Admin", "Secret123!"),
                            new NewTenantRequest("Acme", "acme.com"));
                    assertThat(result.tenantId()).isNotNull();
                });
    }

    @Test
    void shouldSkipSchedulerWhenReconciliationDisabled() {
        contextRunner
                .withBean(IdentityProviderClient.class, InMemoryIdentityProvider::new)
                .withBean(TransactionalStore.class, InMemoryTransactionalStore::new)
                .withPropertyValues("tenancy.reconciliation.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ReconciliationScheduler.class);
                    assertThat(context).hasSingleBean(RegistrationReconciler.class);
                });
    }

    @Test
    void shouldRequireRedisForDistributedLocking() {
        contextRunner
                .withBean(IdentityProviderClient.class, InMemoryIdentityProvider::new)
                .withBean(TransactionalStore.class, InMemoryTransactionalStore::new)
                .withPropertyValues("tenancy.reconciliation.enabled=false",
                        "tenancy.reconciliation.distributed-locking=true")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .hasMessageContaining("StringRedisTemplate");
                });
    }
}
