package com.nayem.tenancy.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.tenancy.audit.FailureLog;
import com.nayem.tenancy.audit.InMemoryFailureLog;
import com.nayem.tenancy.audit.RedisFailureLog;
import com.nayem.tenancy.identity.IdentityProviderClient;
import com.nayem.tenancy.reconcile.NoOpReconciliationLock;
import com.nayem.tenancy.reconcile.ReconciliationLock;
import com.nayem.tenancy.reconcile.ReconciliationScheduler;
import com.nayem.tenancy.reconcile.RedisReconciliationLock;
import com.nayem.tenancy.reconcile.RegistrationReconciler;
import com.nayem.tenancy.saga.SagaEngine;
import com.nayem.tenancy.saga.SagaMetrics;
import com.nayem.tenancy.store.TransactionalStore;
import com.nayem.tenancy.workflow.RegistrationMaterializationSaga;
import com.nayem.tenancy.workflow.TenancyOrchestrator;
import com.nayem.tenancy.workflow.WorkflowSupport;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Wires the saga engine, the provisioning workflows and the reconciliation
 * loop around the application's {@link IdentityProviderClient} and
 * {@link TransactionalStore}.
 */
@AutoConfiguration
@ConditionalOnBean({IdentityProviderClient.class, TransactionalStore.class})
@EnableConfigurationProperties(TenancyProperties.class)
public class TenancyAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock tenancyClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaMetrics sagaMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new SagaMetrics(registryProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaEngine sagaEngine(SagaMetrics sagaMetrics) {
        return new SagaEngine(sagaMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureLog failureLog(TenancyProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider) {

        String store = properties.getFailureLog().getStore();
        return switch (store.toLowerCase()) {
            case "redis" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                ObjectMapper mapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
                if (redis == null) {
                    throw new IllegalStateException("A StringRedisTemplate is required for the Redis failure log");
                }
                yield new RedisFailureLog(redis, mapper, properties.getFailureLog().getTtl());
            }
            default -> new InMemoryFailureLog();
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowSupport workflowSupport(SagaEngine sagaEngine, IdentityProviderClient provider,
            TransactionalStore store, FailureLog failureLog, TenancyProperties properties, Clock clock) {
        return new WorkflowSupport(sagaEngine, provider, store, failureLog, properties.getProviderId(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TenancyOrchestrator tenancyOrchestrator(WorkflowSupport workflowSupport) {
        return new TenancyOrchestrator(workflowSupport);
    }

    @Bean
    @ConditionalOnMissingBean
    public RegistrationReconciler registrationReconciler(WorkflowSupport workflowSupport,
            TenancyProperties properties, SagaMetrics sagaMetrics) {
        return new RegistrationReconciler(
                workflowSupport.provider(),
                workflowSupport.store(),
                new RegistrationMaterializationSaga(workflowSupport),
                properties.getProviderId(),
                properties.getReconciliation().getWindow(),
                workflowSupport.clock(),
                sagaMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReconciliationLock reconciliationLock(TenancyProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {

        if (properties.getReconciliation().isDistributedLocking()) {
            StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
            if (redis == null) {
                throw new IllegalStateException("A StringRedisTemplate is required for distributed reconciliation locking");
            }
            return new RedisReconciliationLock(redis);
        }
        return new NoOpReconciliationLock();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "tenancy.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
    public ReconciliationScheduler reconciliationScheduler(RegistrationReconciler reconciler,
            ReconciliationLock reconciliationLock, TenancyProperties properties) {
        TenancyProperties.Reconciliation reconciliation = properties.getReconciliation();
        return new ReconciliationScheduler(
                reconciler,
                reconciliationLock,
                reconciliation.getInterval(),
                reconciliation.getInitialDelay(),
                reconciliation.getLockTtl());
    }
}
