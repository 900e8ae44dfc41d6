package com.nayem.tenancy.store;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Internal tenant record.
 *
 * @param id        Locally generated id
 * @param name      Display name
 * @param domains   Email domains owned by the tenant; the first one is primary
 * @param createdAt Creation time
 */
public record Tenant(UUID id, String name, List<String> domains, Instant createdAt) {

    public Tenant {
        domains = List.copyOf(domains);
        if (domains.isEmpty()) {
            throw new IllegalArgumentException("Tenant " + name + " must have at least one domain");
        }
    }

    public String primaryDomain() {
        return domains.get(0);
    }
}
