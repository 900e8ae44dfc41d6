package com.nayem.tenancy.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Operator-facing record of a workflow that failed after touching at least one
 * system. It is the source of truth for manual reconciliation when
 * compensation itself partially failed.
 *
 * @param id                     Unique record id
 * @param workflow               Saga or job that failed, e.g. {@code onboarding}
 * @param externalUserId         Provider user id, if one was known
 * @param externalOrgId          Provider organization id, if one was known
 * @param email                  Email of the affected user
 * @param firstName              Given name of the affected user
 * @param lastName               Family name of the affected user
 * @param errorMessage           Message of the triggering failure
 * @param errorClass             Class of the triggering failure
 * @param compensationSucceeded  Whether every compensation ran cleanly
 * @param occurredAt             When the failure was recorded
 */
public record FailureRecord(
        String id,
        String workflow,
        String externalUserId,
        String externalOrgId,
        String email,
        String firstName,
        String lastName,
        String errorMessage,
        String errorClass,
        boolean compensationSucceeded,
        Instant occurredAt) {

    public static Builder builder(String workflow) {
        return new Builder(workflow);
    }

    public static class Builder {
        private final String workflow;
        private String externalUserId;
        private String externalOrgId;
        private String email;
        private String firstName;
        private String lastName;
        private Throwable error;
        private boolean compensationSucceeded;

        private Builder(String workflow) {
            this.workflow = workflow;
        }

        public Builder externalUserId(String externalUserId) {
            this.externalUserId = externalUserId;
            return this;
        }

        public Builder externalOrgId(String externalOrgId) {
            this.externalOrgId = externalOrgId;
            return this;
        }

        public Builder person(String email, String firstName, String lastName) {
            this.email = email;
            this.firstName = firstName;
            this.lastName = lastName;
            return this;
        }

        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        public Builder compensationSucceeded(boolean compensationSucceeded) {
            this.compensationSucceeded = compensationSucceeded;
            return this;
        }

        public FailureRecord build(Instant now) {
            return new FailureRecord(
                    UUID.randomUUID().toString(),
                    workflow,
                    externalUserId,
                    externalOrgId,
                    email,
                    firstName,
                    lastName,
                    error != null ? error.getMessage() : null,
                    error != null ? error.getClass().getName() : null,
                    compensationSucceeded,
                    now);
        }
    }
}
