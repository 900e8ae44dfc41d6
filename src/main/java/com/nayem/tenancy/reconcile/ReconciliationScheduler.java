package com.nayem.tenancy.reconcile;

import com.nayem.tenancy.saga.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs {@link RegistrationReconciler} cycles in the background.
 * <p>
 * Cycles are single-flight: a tick or {@link #triggerNow()} while a cycle is
 * running joins that cycle instead of starting another. With distributed
 * locking enabled, only one instance in the cluster runs a cycle at a time.
 * </p>
 * <p>
 * {@link #stop()} stops future cycles and makes a running cycle stop before
 * its next event; the event in progress is never interrupted.
 * </p>
 */
public class ReconciliationScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    static final String CYCLE_KEY = "registration-reconciliation";

    private final RegistrationReconciler reconciler;
    private final ReconciliationLock lock;
    private final Duration interval;
    private final Duration initialDelay;
    private final Duration lockTtl;
    private final CancellationSignal signal = CancellationSignal.create();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ScheduledExecutorService ticker;
    private final ExecutorService cycleExecutor;
    private final SingleFlightGroup<ReconciliationReport> flights;

    public ReconciliationScheduler(RegistrationReconciler reconciler, ReconciliationLock lock,
            Duration interval, Duration initialDelay, Duration lockTtl) {
        this.reconciler = reconciler;
        this.lock = lock;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.lockTtl = lockTtl;
        this.ticker = Executors.newSingleThreadScheduledExecutor(daemon("tenancy-reconciliation-ticker"));
        this.cycleExecutor = Executors.newSingleThreadExecutor(daemon("tenancy-reconciliation"));
        this.flights = new SingleFlightGroup<>(cycleExecutor);
    }

    /**
     * Schedules cycles at a fixed delay, measured from the end of one cycle to
     * the start of the next. Calling it again has no effect.
     */
    public void start() {
        if (signal.isCancelled()) {
            throw new IllegalStateException("Reconciliation scheduler was stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting registration reconciliation every {} after {}", interval, initialDelay);
        ticker.scheduleWithFixedDelay(this::tick,
                initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Starts a cycle now, or joins the one already running.
     */
    public CompletableFuture<ReconciliationReport> triggerNow() {
        if (signal.isCancelled()) {
            return CompletableFuture.completedFuture(ReconciliationReport.notRun());
        }
        return flights.doCall(CYCLE_KEY, this::runCycle);
    }

    public boolean isCycleRunning() {
        return flights.isInFlight(CYCLE_KEY);
    }

    /**
     * Stops scheduling and asks a running cycle to stop after its current event.
     */
    public void stop() {
        if (signal.isCancelled()) {
            return;
        }
        log.info("Stopping registration reconciliation");
        signal.cancel();
        ticker.shutdown();
        cycleExecutor.shutdown();
    }

    /**
     * Stops and waits for a running cycle to finish its current event.
     */
    @Override
    public void close() {
        stop();
        try {
            if (!cycleExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Reconciliation cycle still running after shutdown timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void tick() {
        if (signal.isCancelled()) {
            return;
        }
        try {
            triggerNow().join();
        } catch (CompletionException e) {
            log.error("Registration reconciliation cycle failed", e.getCause());
        } catch (RuntimeException e) {
            // Scheduled tasks stop repeating once they throw.
            log.error("Registration reconciliation cycle failed", e);
        }
    }

    private ReconciliationReport runCycle() {
        if (!lock.acquireLock(CYCLE_KEY, lockTtl.toMillis())) {
            log.debug("Reconciliation cycle already running on another instance");
            return ReconciliationReport.notRun();
        }
        try {
            return reconciler.reconcile(signal);
        } finally {
            lock.releaseLock(CYCLE_KEY);
        }
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
