package com.nayem.tenancy.store;

import java.util.Optional;
import java.util.UUID;

public interface TenantRepository {

    void add(Tenant tenant);

    Optional<Tenant> findById(UUID id);

    /**
     * Find the tenant owning a domain, primary or not.
     */
    Optional<Tenant> findByDomain(String domain);
}
