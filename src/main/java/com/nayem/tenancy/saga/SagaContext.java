package com.nayem.tenancy.saga;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable bag of typed facts written by saga steps as they succeed.
 * <p>
 * A context is created per saga invocation and discarded when the saga
 * returns. It is never shared between invocations, so it needs no
 * synchronization: steps run strictly in sequence on the calling thread.
 * </p>
 */
public class SagaContext {

    private final Map<ContextKey<?>, Object> facts;
    private final CancellationSignal signal;

    public SagaContext() {
        this(CancellationSignal.none());
    }

    public SagaContext(CancellationSignal signal) {
        this(new LinkedHashMap<>(), signal);
    }

    private SagaContext(Map<ContextKey<?>, Object> facts, CancellationSignal signal) {
        this.facts = facts;
        this.signal = Objects.requireNonNull(signal, "signal");
    }

    /**
     * Records a fact. Call only after the action producing it succeeded.
     */
    public <V> SagaContext put(ContextKey<V> key, V value) {
        facts.put(key, Objects.requireNonNull(value, () -> "value for " + key));
        return this;
    }

    public <V> Optional<V> get(ContextKey<V> key) {
        return Optional.ofNullable(facts.get(key)).map(key::cast);
    }

    /**
     * Returns a fact that an earlier step must have produced.
     *
     * @throws NoSuchElementException if the fact was never recorded
     */
    public <V> V require(ContextKey<V> key) {
        return get(key).orElseThrow(() -> new NoSuchElementException("Saga fact '" + key + "' was never recorded"));
    }

    /**
     * Boolean facts default to {@code false} until a step sets them.
     */
    public boolean isSet(ContextKey<Boolean> key) {
        return get(key).orElse(Boolean.FALSE);
    }

    public boolean has(ContextKey<?> key) {
        return facts.containsKey(key);
    }

    public CancellationSignal signal() {
        return signal;
    }

    /**
     * A view over the same facts bound to a signal that is never cancelled.
     * Compensation always runs on this view.
     */
    public SagaContext forCompensation() {
        return new SagaContext(facts, CancellationSignal.none());
    }

    /**
     * Snapshot of the recorded facts by name, for logging.
     */
    public Map<String, Object> describe() {
        Map<String, Object> view = new LinkedHashMap<>();
        facts.forEach((key, value) -> view.put(key.name(), value));
        return Collections.unmodifiableMap(view);
    }
}
