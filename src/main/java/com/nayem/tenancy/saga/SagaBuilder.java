package com.nayem.tenancy.saga;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * A fluent builder for {@link TenancySaga} instances, so workflows are
 * declared as data instead of hand-written control flow.
 *
 * <h3>Example Usage:</h3>
 *
 * <pre>{@code
 * TenancySaga saga = SagaBuilder.newSaga("user-creation")
 *         .description("Create user jane@acme.test")
 *         .step(steps.createUser(model))
 *         .stepIf(orgId != null, () -> steps.linkUserToOrganization(ctx -> orgId))
 *         .step(persistUser)
 *         .build();
 * }</pre>
 */
public class SagaBuilder {

    private final String sagaName;
    private final List<SagaStep> steps = new ArrayList<>();
    private String description;

    private SagaBuilder(String sagaName) {
        this.sagaName = sagaName;
    }

    /**
     * Creates a new SagaBuilder.
     *
     * @param sagaName Name of the workflow
     * @return A new builder instance
     */
    public static SagaBuilder newSaga(String sagaName) {
        if (sagaName == null || sagaName.isBlank()) {
            throw new IllegalArgumentException("sagaName is required");
        }
        return new SagaBuilder(sagaName);
    }

    /**
     * Adds a description for logging/monitoring.
     */
    public SagaBuilder description(String description) {
        this.description = description;
        return this;
    }

    /**
     * Adds a step to the saga.
     */
    public SagaBuilder step(SagaStep step) {
        if (steps.stream().anyMatch(existing -> existing.getStepId().equals(step.getStepId()))) {
            throw new IllegalStateException("Duplicate step id '" + step.getStepId() + "' in saga " + sagaName);
        }
        steps.add(step);
        return this;
    }

    /**
     * Adds a step only when {@code condition} holds.
     */
    public SagaBuilder stepIf(boolean condition, Supplier<SagaStep> step) {
        if (condition) {
            step(step.get());
        }
        return this;
    }

    /**
     * Builds the saga. A saga without steps is valid and succeeds immediately.
     */
    public TenancySaga build() {
        List<SagaStep> frozen = List.copyOf(steps);
        String desc = description != null ? description : sagaName;
        return new TenancySaga() {
            @Override
            public String getSagaName() {
                return sagaName;
            }

            @Override
            public List<SagaStep> getSteps() {
                return frozen;
            }

            @Override
            public String getDescription() {
                return desc;
            }
        };
    }
}
