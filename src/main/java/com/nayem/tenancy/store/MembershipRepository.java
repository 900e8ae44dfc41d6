package com.nayem.tenancy.store;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MembershipRepository {

    void add(Membership membership);

    Optional<Membership> find(UUID tenantId, UUID userId);

    /**
     * Count the members of a tenant holding the given role.
     */
    long countWithRole(UUID tenantId, TenantRole role);

    /**
     * Remove every membership of a user, in all tenants.
     *
     * @return the removed memberships
     */
    List<Membership> deleteForUser(UUID userId);
}
