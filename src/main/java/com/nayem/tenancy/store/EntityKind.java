package com.nayem.tenancy.store;

/**
 * Kind of internal entity an {@link ExternalIdentityMapping} points at.
 */
public enum EntityKind {
    USER,
    TENANT
}
