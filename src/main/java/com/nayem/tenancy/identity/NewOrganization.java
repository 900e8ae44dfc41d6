package com.nayem.tenancy.identity;

/**
 * Request to create an organization in the identity provider.
 *
 * @param name   Display name
 * @param domain Primary domain; the provider rejects duplicates
 */
public record NewOrganization(String name, String domain) {
}
