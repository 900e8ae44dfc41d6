package com.nayem.tenancy.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Configuration properties for tenant and user provisioning.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code tenancy} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "tenancy")
@Validated
public class TenancyProperties {

    /**
     * Id of the identity provider in external identity mappings. Defaults to
     * the id the provider row is seeded with.
     */
    @NotNull
    private UUID providerId = UUID.fromString("049284c1-ff29-4f28-869f-f64300b69719");

    /**
     * Background absorption of registrations made directly against the provider.
     */
    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    /**
     * Where failed workflows are recorded for operators.
     */
    @Valid
    private FailureLog failureLog = new FailureLog();

    /** @return the identity provider id */
    public UUID getProviderId() {
        return providerId;
    }

    /** @param providerId the identity provider id */
    public void setProviderId(UUID providerId) {
        this.providerId = providerId;
    }

    /** @return the reconciliation configuration */
    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    /** @param reconciliation the reconciliation configuration */
    public void setReconciliation(Reconciliation reconciliation) {
        this.reconciliation = reconciliation;
    }

    /** @return the failure log configuration */
    public FailureLog getFailureLog() {
        return failureLog;
    }

    /** @param failureLog the failure log configuration */
    public void setFailureLog(FailureLog failureLog) {
        this.failureLog = failureLog;
    }

    /**
     * Configuration for the registration reconciliation loop.
     * <p>
     * Each cycle looks back over {@code window}, which must be longer than
     * {@code interval} so a late or missed tick loses no events.
     * </p>
     */
    public static class Reconciliation {
        /**
         * Whether the reconciliation loop runs.
         */
        private boolean enabled = true;

        /**
         * Delay between the end of one cycle and the start of the next.
         */
        @NotNull
        @DurationUnit(ChronoUnit.MINUTES)
        private Duration interval = Duration.ofMinutes(1);

        /**
         * Delay before the first cycle after startup.
         */
        @NotNull
        @DurationUnit(ChronoUnit.MINUTES)
        private Duration initialDelay = Duration.ofMinutes(1);

        /**
         * How far back each cycle asks the provider for registrations.
         */
        @NotNull
        @DurationUnit(ChronoUnit.MINUTES)
        private Duration window = Duration.ofMinutes(70);

        /**
         * Use a Redis lock so only one instance runs a cycle at a time.
         */
        private boolean distributedLocking = false;

        /**
         * Expiry of the distributed lock, in case its holder dies mid-cycle.
         */
        @NotNull
        @DurationUnit(ChronoUnit.MINUTES)
        private Duration lockTtl = Duration.ofMinutes(10);

        /** @return whether reconciliation is enabled */
        public boolean isEnabled() {
            return enabled;
        }

        /** @param enabled whether reconciliation is enabled */
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** @return the delay between cycles */
        public Duration getInterval() {
            return interval;
        }

        /** @param interval the delay between cycles */
        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        /** @return the delay before the first cycle */
        public Duration getInitialDelay() {
            return initialDelay;
        }

        /** @param initialDelay the delay before the first cycle */
        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        /** @return the look-back window */
        public Duration getWindow() {
            return window;
        }

        /** @param window the look-back window */
        public void setWindow(Duration window) {
            this.window = window;
        }

        /** @return whether distributed locking is enabled */
        public boolean isDistributedLocking() {
            return distributedLocking;
        }

        /** @param distributedLocking whether distributed locking is enabled */
        public void setDistributedLocking(boolean distributedLocking) {
            this.distributedLocking = distributedLocking;
        }

        /** @return the distributed lock expiry */
        public Duration getLockTtl() {
            return lockTtl;
        }

        /** @param lockTtl the distributed lock expiry */
        public void setLockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
        }

        @AssertTrue(message = "tenancy.reconciliation interval, window and lock-ttl must be positive "
                + "and initial-delay must not be negative")
        public boolean isDurationsPositive() {
            return isPositive(interval) && isPositive(window) && isPositive(lockTtl)
                    && (initialDelay == null || !initialDelay.isNegative());
        }

        private static boolean isPositive(Duration duration) {
            return duration == null || (!duration.isNegative() && !duration.isZero());
        }

        @AssertTrue(message = "tenancy.reconciliation.window must be longer than tenancy.reconciliation.interval")
        public boolean isWindowLongerThanInterval() {
            return window == null || interval == null || window.compareTo(interval) > 0;
        }
    }

    /**
     * Configuration for the failure log.
     */
    public static class FailureLog {
        /**
         * Storage backend: 'memory' (development) or 'redis' (production).
         */
        @Pattern(regexp = "memory|redis", flags = Pattern.Flag.CASE_INSENSITIVE)
        private String store = "memory";

        /**
         * How long a record stays addressable by id in Redis.
         */
        @DurationUnit(ChronoUnit.DAYS)
        private Duration ttl = Duration.ofDays(30);

        /** @return the storage backend */
        public String getStore() {
            return store;
        }

        /** @param store the storage backend */
        public void setStore(String store) {
            this.store = store;
        }

        @AssertTrue(message = "tenancy.failure-log.ttl must be positive")
        public boolean isTtlPositive() {
            return ttl == null || (!ttl.isNegative() && !ttl.isZero());
        }

        /** @return the record TTL */
        public Duration getTtl() {
            return ttl;
        }

        /** @param ttl the record TTL */
        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }
}
