package com.nayem.tenancy.reconcile;

import com.nayem.tenancy.identity.IdentityProviderClient;
import com.nayem.tenancy.identity.RegistrationEvent;
import com.nayem.tenancy.saga.CancellationSignal;
import com.nayem.tenancy.saga.SagaExecutionException;
import com.nayem.tenancy.saga.SagaMetrics;
import com.nayem.tenancy.store.TransactionalStore;
import com.nayem.tenancy.workflow.RegistrationMaterializationSaga;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one reconciliation cycle: absorbs registrations made directly against
 * the identity provider into the local store.
 * <p>
 * The poll window overlaps earlier cycles, so every event is first checked
 * against the external identity mappings and skipped if already materialized.
 * A bad or failing event is counted and the cycle moves on.
 * </p>
 */
public class RegistrationReconciler {

    private static final Logger log = LoggerFactory.getLogger(RegistrationReconciler.class);

    private final IdentityProviderClient provider;
    private final TransactionalStore store;
    private final RegistrationMaterializationSaga materializer;
    private final UUID providerId;
    private final Duration window;
    private final Clock clock;
    private final SagaMetrics metrics;

    public RegistrationReconciler(IdentityProviderClient provider, TransactionalStore store,
            RegistrationMaterializationSaga materializer, UUID providerId, Duration window,
            Clock clock, SagaMetrics metrics) {
        this.provider = provider;
        this.store = store;
        this.materializer = materializer;
        this.providerId = providerId;
        this.window = window;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Runs a cycle. Cancellation is checked before each event; an event already
     * being processed always finishes.
     */
    public ReconciliationReport reconcile(CancellationSignal signal) {
        Instant since = clock.instant().minus(window);
        List<RegistrationEvent> events = provider.listRecentRegistrationEvents(since, signal);
        log.info("Reconciling {} registration event(s) since {}", events.size(), since);

        int succeeded = 0;
        int skipped = 0;
        int failed = 0;
        boolean cancelled = false;

        for (RegistrationEvent event : events) {
            if (signal.isCancelled()) {
                log.info("Reconciliation cancelled with {} event(s) left",
                        events.size() - succeeded - skipped - failed);
                cancelled = true;
                break;
            }
            MDC.put("registrationUser", String.valueOf(event.externalUserId()));
            try {
                switch (process(event)) {
                    case MATERIALIZED -> succeeded++;
                    case ALREADY_PRESENT -> skipped++;
                    default -> failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Unexpected error reconciling registration of user {}", event.externalUserId(), e);
            } finally {
                MDC.remove("registrationUser");
            }
        }

        metrics.recordReconciliation(succeeded, skipped, failed);
        log.info("Reconciliation finished: {} materialized, {} skipped, {} failed", succeeded, skipped, failed);
        return new ReconciliationReport(events.size(), succeeded, skipped, failed, cancelled);
    }

    private Outcome process(RegistrationEvent event) {
        if (!isBlank(event.externalUserId())
                && store.openUnitOfWork().mappings().find(providerId, event.externalUserId()).isPresent()) {
            log.debug("Registration of user {} already materialized, skipping", event.externalUserId());
            return Outcome.ALREADY_PRESENT;
        }

        List<String> missing = missingFields(event);
        if (!missing.isEmpty()) {
            log.warn("Skipping registration event for user {}: missing {}", event.externalUserId(), missing);
            return Outcome.INVALID;
        }

        try {
            // A started event runs to completion even if the cycle is cancelled meanwhile.
            UUID userId = materializer.materialize(event, CancellationSignal.none());
            log.info("Materialized registration of {} as user {}", event.email(), userId);
            return Outcome.MATERIALIZED;
        } catch (SagaExecutionException e) {
            log.warn("Failed to materialize registration of {} at step {}: {}",
                    event.email(), e.getFailedStepId(), e.getCause() != null ? e.getCause().getMessage() : null);
            return Outcome.FAILED;
        }
    }

    private static List<String> missingFields(RegistrationEvent event) {
        List<String> missing = new ArrayList<>();
        if (isBlank(event.email())) {
            missing.add("email");
        }
        if (isBlank(event.externalUserId())) {
            missing.add("externalUserId");
        }
        if (isBlank(event.externalOrgId())) {
            missing.add("externalOrgId");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private enum Outcome {
        MATERIALIZED,
        ALREADY_PRESENT,
        INVALID,
        FAILED
    }
}
