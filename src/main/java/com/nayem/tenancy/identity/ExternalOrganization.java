package com.nayem.tenancy.identity;

import java.util.List;

/**
 * An organization as the identity provider reports it.
 *
 * @param id      Provider-issued identifier
 * @param name    Display name
 * @param domains Registered domains, primary first
 */
public record ExternalOrganization(String id, String name, List<String> domains) {

    public ExternalOrganization {
        domains = List.copyOf(domains);
    }

    public String primaryDomain() {
        return domains.isEmpty() ? null : domains.get(0);
    }
}
