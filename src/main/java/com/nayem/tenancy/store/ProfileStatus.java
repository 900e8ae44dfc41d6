package com.nayem.tenancy.store;

public enum ProfileStatus {
    ACTIVE,
    INACTIVE
}
