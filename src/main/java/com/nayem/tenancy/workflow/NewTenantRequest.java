package com.nayem.tenancy.workflow;

import com.nayem.tenancy.identity.NewOrganization;

import java.util.Objects;

/**
 * A tenant to provision. The domain becomes the tenant's primary domain.
 */
public record NewTenantRequest(String name, String domain) {

    public NewTenantRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(domain, "domain");
    }

    NewOrganization toOrganization() {
        return new NewOrganization(name, domain);
    }
}
