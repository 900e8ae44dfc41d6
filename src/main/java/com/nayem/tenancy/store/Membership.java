package com.nayem.tenancy.store;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * A user's membership in a tenant together with the roles granted there.
 */
public record Membership(UUID id, UUID tenantId, UUID userId, Set<TenantRole> roles, Instant joinedAt) {

    public Membership {
        roles = Set.copyOf(roles);
    }

    public static Membership grant(UUID tenantId, UUID userId, TenantRole role, Instant now) {
        return new Membership(UUID.randomUUID(), tenantId, userId, Set.of(role), now);
    }

    public boolean hasRole(TenantRole role) {
        return roles.contains(role);
    }
}
