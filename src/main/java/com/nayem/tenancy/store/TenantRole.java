package com.nayem.tenancy.store;

/**
 * Roles a user can hold inside a tenant.
 */
public enum TenantRole {
    ORG_ADMIN("org-admin"),
    ORG_MANAGER("org-manager"),
    ORG_USER("org-user");

    private final String roleName;

    TenantRole(String roleName) {
        this.roleName = roleName;
    }

    /**
     * @return the role name as the identity provider knows it
     */
    public String roleName() {
        return roleName;
    }
}
