package com.nayem.tenancy.workflow;

import com.nayem.tenancy.audit.FailureRecord;
import com.nayem.tenancy.saga.SagaContext;
import com.nayem.tenancy.saga.SagaExecutionException;
import com.nayem.tenancy.saga.SagaResult;
import com.nayem.tenancy.saga.TenancySaga;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_ORG_ID;
import static com.nayem.tenancy.workflow.ProvisioningFacts.EXTERNAL_USER_ID;

/**
 * Base for workflows that run a saga and audit its failures.
 */
abstract class AbstractProvisioningWorkflow {

    private static final Logger log = LoggerFactory.getLogger(AbstractProvisioningWorkflow.class);

    protected final WorkflowSupport support;
    protected final ProvisioningSteps steps;

    protected AbstractProvisioningWorkflow(WorkflowSupport support) {
        this.support = support;
        this.steps = new ProvisioningSteps(support);
    }

    /**
     * Runs the saga. If it fails after a step with side effects completed, a
     * failure record is written before the original error is re-raised.
     *
     * @throws SagaExecutionException if a forward step failed
     */
    protected SagaResult runAudited(TenancySaga saga, SagaContext context, FailureRecord.Builder audit) {
        SagaResult result = support.engine().run(saga, context);
        if (result.succeeded()) {
            return result;
        }
        if (result.hadSideEffects()) {
            context.get(EXTERNAL_USER_ID).ifPresent(audit::externalUserId);
            context.get(EXTERNAL_ORG_ID).ifPresent(audit::externalOrgId);
            FailureRecord record = audit
                    .error(result.error())
                    .compensationSucceeded(result.compensationSucceeded())
                    .build(support.clock().instant());
            try {
                support.failureLog().record(record);
            } catch (RuntimeException e) {
                log.error("Could not write failure record for saga {}: {}", saga.getSagaName(), record, e);
            }
        }
        throw new SagaExecutionException(result);
    }
}
