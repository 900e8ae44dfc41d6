package com.nayem.tenancy.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Unit of work over an {@link InMemoryTransactionalStore}.
 * <p>
 * Writes are staged per table and become visible to others only on commit.
 * Reads inside the transaction see the staged writes.
 * </p>
 */
public class InMemoryUnitOfWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUnitOfWork.class);

    private final InMemoryTransactionalStore store;
    private final StagedTable<User> users;
    private final StagedTable<Tenant> tenants;
    private final StagedTable<ExternalIdentityMapping> mappings;
    private final StagedTable<Membership> memberships;
    private final StagedTable<Profile> profiles;
    private boolean active;

    public InMemoryUnitOfWork(InMemoryTransactionalStore store) {
        this.store = store;
        this.users = new StagedTable<>(store.users, User::id);
        this.tenants = new StagedTable<>(store.tenants, Tenant::id);
        this.mappings = new StagedTable<>(store.mappings, ExternalIdentityMapping::id);
        this.memberships = new StagedTable<>(store.memberships, Membership::id);
        this.profiles = new StagedTable<>(store.profiles, Profile::id);
    }

    @Override
    public void begin() {
        if (active) {
            throw new IllegalStateException("Transaction already active");
        }
        active = true;
    }

    @Override
    public void commit() {
        requireActive();
        synchronized (store.commitLock) {
            try {
                verifyConstraints();
            } catch (StoreException e) {
                rollback();
                throw e;
            }
            users.applyTo(store.users);
            tenants.applyTo(store.tenants);
            mappings.applyTo(store.mappings);
            memberships.applyTo(store.memberships);
            profiles.applyTo(store.profiles);
        }
        clearStaged();
        active = false;
    }

    @Override
    public void rollback() {
        if (!active) {
            return;
        }
        log.debug("Rolling back unit of work");
        clearStaged();
        active = false;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public UserRepository users() {
        return new UserRepository() {
            @Override
            public void add(User user) {
                requireActive();
                users.put(user);
            }

            @Override
            public Optional<User> findById(UUID id) {
                return users.get(id);
            }

            @Override
            public Optional<User> findByEmail(String email) {
                return users.rows().filter(u -> u.email().equalsIgnoreCase(email)).findFirst();
            }

            @Override
            public void delete(UUID id) {
                requireActive();
                users.remove(id);
            }
        };
    }

    @Override
    public TenantRepository tenants() {
        return new TenantRepository() {
            @Override
            public void add(Tenant tenant) {
                requireActive();
                tenants.put(tenant);
            }

            @Override
            public Optional<Tenant> findById(UUID id) {
                return tenants.get(id);
            }

            @Override
            public Optional<Tenant> findByDomain(String domain) {
                return tenants.rows().filter(t -> t.domains().contains(domain)).findFirst();
            }
        };
    }

    @Override
    public ExternalIdentityRepository mappings() {
        return new ExternalIdentityRepository() {
            @Override
            public void add(ExternalIdentityMapping mapping) {
                requireActive();
                mappings.put(mapping);
            }

            @Override
            public Optional<ExternalIdentityMapping> find(UUID providerId, String externalId) {
                return mappings.rows()
                        .filter(m -> m.providerId().equals(providerId) && m.externalId().equals(externalId))
                        .findFirst();
            }

            @Override
            public Optional<ExternalIdentityMapping> findForEntity(EntityKind kind, UUID internalId, UUID providerId) {
                return mappings.rows()
                        .filter(m -> m.entityKind() == kind
                                && m.internalId().equals(internalId)
                                && m.providerId().equals(providerId))
                        .findFirst();
            }

            @Override
            public void delete(UUID mappingId) {
                requireActive();
                mappings.remove(mappingId);
            }
        };
    }

    @Override
    public MembershipRepository memberships() {
        return new MembershipRepository() {
            @Override
            public void add(Membership membership) {
                requireActive();
                memberships.put(membership);
            }

            @Override
            public Optional<Membership> find(UUID tenantId, UUID userId) {
                return memberships.rows()
                        .filter(m -> m.tenantId().equals(tenantId) && m.userId().equals(userId))
                        .findFirst();
            }

            @Override
            public long countWithRole(UUID tenantId, TenantRole role) {
                return memberships.rows()
                        .filter(m -> m.tenantId().equals(tenantId) && m.hasRole(role))
                        .count();
            }

            @Override
            public List<Membership> deleteForUser(UUID userId) {
                requireActive();
                List<Membership> removed = memberships.rows().filter(m -> m.userId().equals(userId)).toList();
                removed.forEach(m -> memberships.remove(m.id()));
                return removed;
            }
        };
    }

    @Override
    public ProfileRepository profiles() {
        return new ProfileRepository() {
            @Override
            public void add(Profile profile) {
                requireActive();
                profiles.put(profile);
            }

            @Override
            public void update(Profile profile) {
                requireActive();
                if (profiles.get(profile.id()).isEmpty()) {
                    throw new StoreException("Profile " + profile.id() + " does not exist");
                }
                profiles.put(profile);
            }

            @Override
            public Optional<Profile> findByMembership(UUID membershipId) {
                return profiles.rows().filter(p -> p.membershipId().equals(membershipId)).findFirst();
            }

            @Override
            public void deleteByMembership(UUID membershipId) {
                requireActive();
                profiles.rows()
                        .filter(p -> p.membershipId().equals(membershipId))
                        .map(Profile::id)
                        .toList()
                        .forEach(profiles::remove);
            }
        };
    }

    private void verifyConstraints() {
        Set<String> externalKeys = new HashSet<>();
        for (ExternalIdentityMapping mapping : mappings.merged()) {
            if (!externalKeys.add(mapping.providerId() + "/" + mapping.externalId())) {
                throw new StoreException("Duplicate external identity mapping for provider "
                        + mapping.providerId() + " and external id " + mapping.externalId());
            }
        }
        List<String> primaryDomains = new ArrayList<>();
        for (Tenant tenant : tenants.merged()) {
            String domain = tenant.primaryDomain().toLowerCase();
            if (primaryDomains.contains(domain)) {
                throw new StoreException("Tenant domain already in use: " + tenant.primaryDomain());
            }
            primaryDomains.add(domain);
        }
    }

    private void requireActive() {
        if (!active) {
            throw new IllegalStateException("No active transaction");
        }
    }

    private void clearStaged() {
        users.clear();
        tenants.clear();
        mappings.clear();
        memberships.clear();
        profiles.clear();
    }
}
