package com.nayem.tenancy.saga;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class FunctionalSagaStepTest {

    private static final ContextKey<String> ORG_ID = ContextKey.of("orgId", String.class);

    @Test
    void testExecuteDelegatesToLambda() throws Exception {
        FunctionalSagaStep step = FunctionalSagaStep.builder()
                .stepId("create-org")
                .execute(ctx -> ctx.put(ORG_ID, "org-1"))
                .build();

        SagaContext context = new SagaContext();
        step.execute(context);

        assertEquals("create-org", step.getStepId());
        assertEquals("org-1", context.require(ORG_ID));
    }

    @Test
    void testCompensateDelegatesToLambda() throws Exception {
        AtomicBoolean compensated = new AtomicBoolean();
        FunctionalSagaStep step = FunctionalSagaStep.builder()
                .stepId("create-org")
                .execute(ctx -> { })
                .compensate(ctx -> compensated.set(true))
                .build();

        assertTrue(step.hasCompensation());
        step.compensate(new SagaContext());
        assertTrue(compensated.get());
    }

    @Test
    void testStepWithoutCompensation() throws Exception {
        FunctionalSagaStep step = FunctionalSagaStep.builder()
                .stepId("read")
                .execute(ctx -> { })
                .build();

        assertFalse(step.hasCompensation());
        assertDoesNotThrow(() -> step.compensate(new SagaContext()));
    }

    @Test
    void testBuilderRequiresStepId() {
        assertThrows(IllegalStateException.class, () -> FunctionalSagaStep.builder()
                .execute(ctx -> { })
                .build());
    }

    @Test
    void testBuilderRequiresExecutor() {
        assertThrows(IllegalStateException.class, () -> FunctionalSagaStep.builder()
                .stepId("no-op")
                .build());
    }
}
