package com.nayem.tenancy.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link TransactionalStore}.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Single-instance deployments
 * </p>
 * <p>
 * Note: State is lost on application restart. Commits are serialized on the
 * store, which is where mapping and primary-domain uniqueness is enforced.
 * </p>
 */
public class InMemoryTransactionalStore implements TransactionalStore {

    final Map<UUID, User> users = new ConcurrentHashMap<>();
    final Map<UUID, Tenant> tenants = new ConcurrentHashMap<>();
    final Map<UUID, ExternalIdentityMapping> mappings = new ConcurrentHashMap<>();
    final Map<UUID, Membership> memberships = new ConcurrentHashMap<>();
    final Map<UUID, Profile> profiles = new ConcurrentHashMap<>();

    final Object commitLock = new Object();

    @Override
    public UnitOfWork openUnitOfWork() {
        return new InMemoryUnitOfWork(this);
    }

    public List<User> committedUsers() {
        return new ArrayList<>(users.values());
    }

    public List<Tenant> committedTenants() {
        return new ArrayList<>(tenants.values());
    }

    public List<ExternalIdentityMapping> committedMappings() {
        return new ArrayList<>(mappings.values());
    }

    public List<Membership> committedMemberships() {
        return new ArrayList<>(memberships.values());
    }

    public List<Profile> committedProfiles() {
        return new ArrayList<>(profiles.values());
    }

    /**
     * Clears all stored state. Useful for testing.
     */
    public void clear() {
        synchronized (commitLock) {
            users.clear();
            tenants.clear();
            mappings.clear();
            memberships.clear();
            profiles.clear();
        }
    }
}
