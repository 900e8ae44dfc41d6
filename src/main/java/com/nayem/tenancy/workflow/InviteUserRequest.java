package com.nayem.tenancy.workflow;

import java.util.Objects;
import java.util.UUID;

/**
 * Invitation of a user, new or existing, into a tenant.
 *
 * @param tenantId Internal id of the tenant
 */
public record InviteUserRequest(UUID tenantId, String email, String firstName, String lastName) {

    public InviteUserRequest {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(email, "email");
    }
}
