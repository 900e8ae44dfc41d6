package com.nayem.tenancy.saga;

/**
 * A functional adapter for {@link SagaStep} that allows defining saga steps
 * using lambdas.
 *
 * <h3>Example Usage:</h3>
 *
 * <pre>{@code
 * SagaStep createOrg = FunctionalSagaStep.builder()
 *         .stepId("create-organization")
 *         .execute(ctx -> {
 *             provider.createOrganization(org);
 *             ctx.put(EXTERNAL_ORG_ID, provider.findOrganizationByDomain(org.domain()).id());
 *         })
 *         .compensate(ctx -> ctx.get(EXTERNAL_ORG_ID).ifPresent(provider::deleteOrganization))
 *         .build();
 * }</pre>
 */
public class FunctionalSagaStep implements SagaStep {

    private final String stepId;
    private final ContextAction executor;
    private final ContextAction compensator;

    private FunctionalSagaStep(Builder builder) {
        this.stepId = builder.stepId;
        this.executor = builder.executor;
        this.compensator = builder.compensator;
    }

    /**
     * Creates a new builder for FunctionalSagaStep.
     *
     * @return A new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getStepId() {
        return stepId;
    }

    @Override
    public void execute(SagaContext context) throws Exception {
        executor.apply(context);
    }

    @Override
    public void compensate(SagaContext context) throws Exception {
        if (compensator != null) {
            compensator.apply(context);
        }
    }

    @Override
    public boolean hasCompensation() {
        return compensator != null;
    }

    @Override
    public String toString() {
        return "SagaStep[" + stepId + "]";
    }

    /**
     * An action over the saga context that may fail with any exception.
     */
    @FunctionalInterface
    public interface ContextAction {
        void apply(SagaContext context) throws Exception;
    }

    /**
     * Builder for creating {@link FunctionalSagaStep} instances.
     */
    public static class Builder {
        private String stepId;
        private ContextAction executor;
        private ContextAction compensator;

        /**
         * Sets the unique step ID.
         */
        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        /**
         * Sets the forward execution logic.
         */
        public Builder execute(ContextAction executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Sets the compensation logic for rollback.
         */
        public Builder compensate(ContextAction compensator) {
            this.compensator = compensator;
            return this;
        }

        /**
         * Builds the FunctionalSagaStep.
         *
         * @throws IllegalStateException if required fields are missing
         */
        public FunctionalSagaStep build() {
            if (stepId == null || stepId.isBlank()) {
                throw new IllegalStateException("stepId is required");
            }
            if (executor == null) {
                throw new IllegalStateException("execute function is required");
            }
            return new FunctionalSagaStep(this);
        }
    }
}
