package com.nayem.tenancy.store;

import com.nayem.tenancy.saga.CancellationSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransactionalStoreTest {

    private static final UUID PROVIDER = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryTransactionalStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTransactionalStore();
    }

    private static User user(String email) {
        return new User(UUID.randomUUID(), email, NOW);
    }

    @Test
    void testWritesInvisibleUntilCommit() {
        UnitOfWork writer = store.openUnitOfWork();
        UnitOfWork reader = store.openUnitOfWork();
        User alice = user("alice@acme.com");

        writer.begin();
        writer.users().add(alice);

        assertTrue(writer.users().findById(alice.id()).isPresent());
        assertTrue(reader.users().findById(alice.id()).isEmpty());
        assertTrue(store.committedUsers().isEmpty());

        writer.commit();

        assertFalse(writer.isActive());
        assertTrue(reader.users().findById(alice.id()).isPresent());
        assertEquals(List.of(alice), store.committedUsers());
    }

    @Test
    void testCancelledCommitLeavesTransactionOpen() {
        UnitOfWork uow = store.openUnitOfWork();
        CancellationSignal signal = CancellationSignal.create();
        uow.begin();
        uow.users().add(user("carol@acme.com"));
        signal.cancel();

        assertThrows(CancellationException.class, () -> uow.commit(signal));

        assertTrue(uow.isActive());
        assertTrue(store.committedUsers().isEmpty());
        uow.rollback();
    }

    @Test
    void testRollbackDiscardsStagedWrites() {
        UnitOfWork uow = store.openUnitOfWork();
        uow.begin();
        uow.users().add(user("bob@acme.com"));
        uow.rollback();

        assertFalse(uow.isActive());
        assertTrue(store.committedUsers().isEmpty());
        assertDoesNotThrow(uow::rollback);
    }

    @Test
    void testWritesRequireActiveTransaction() {
        UnitOfWork uow = store.openUnitOfWork();
        assertThrows(IllegalStateException.class, () -> uow.users().add(user("carol@acme.com")));
        assertThrows(IllegalStateException.class, uow::commit);
    }

    @Test
    void testBeginTwiceRejected() {
        UnitOfWork uow = store.openUnitOfWork();
        uow.begin();
        assertThrows(IllegalStateException.class, uow::begin);
    }

    @Test
    void testDuplicateMappingFailsCommitAndRollsBack() {
        UnitOfWork first = store.openUnitOfWork();
        first.begin();
        first.mappings().add(ExternalIdentityMapping.create(UUID.randomUUID(), "kc-1", EntityKind.USER, PROVIDER, NOW));
        first.commit();

        UnitOfWork second = store.openUnitOfWork();
        second.begin();
        User dave = user("dave@acme.com");
        second.users().add(dave);
        second.mappings().add(ExternalIdentityMapping.create(dave.id(), "kc-1", EntityKind.USER, PROVIDER, NOW));

        assertThrows(StoreException.class, second::commit);
        assertFalse(second.isActive());
        assertTrue(store.committedUsers().isEmpty());
        assertEquals(1, store.committedMappings().size());
    }

    @Test
    void testSameExternalIdUnderAnotherProviderIsAllowed() {
        UnitOfWork uow = store.openUnitOfWork();
        uow.begin();
        uow.mappings().add(ExternalIdentityMapping.create(UUID.randomUUID(), "ext", EntityKind.USER, PROVIDER, NOW));
        uow.mappings().add(ExternalIdentityMapping.create(UUID.randomUUID(), "ext", EntityKind.USER, UUID.randomUUID(), NOW));

        assertDoesNotThrow(() -> uow.commit());
        assertEquals(2, store.committedMappings().size());
    }

    @Test
    void testDuplicatePrimaryDomainFailsCommit() {
        UnitOfWork first = store.openUnitOfWork();
        first.begin();
        first.tenants().add(new Tenant(UUID.randomUUID(), "Acme", List.of("acme.com"), NOW));
        first.commit();

        UnitOfWork second = store.openUnitOfWork();
        second.begin();
        second.tenants().add(new Tenant(UUID.randomUUID(), "Acme Again", List.of("ACME.com"), NOW));

        assertThrows(StoreException.class, second::commit);
        assertEquals(1, store.committedTenants().size());
    }

    @Test
    void testMembershipQueries() {
        UUID tenantId = UUID.randomUUID();
        UUID admin = UUID.randomUUID();
        UUID member = UUID.randomUUID();

        UnitOfWork uow = store.openUnitOfWork();
        uow.begin();
        Membership adminMembership = Membership.grant(tenantId, admin, TenantRole.ORG_ADMIN, NOW);
        uow.memberships().add(adminMembership);
        uow.memberships().add(Membership.grant(tenantId, member, TenantRole.ORG_USER, NOW));
        uow.profiles().add(Profile.active(adminMembership.id(), "Ada", "Admin", NOW));
        uow.commit();

        UnitOfWork reader = store.openUnitOfWork();
        assertEquals(1, reader.memberships().countWithRole(tenantId, TenantRole.ORG_ADMIN));
        assertTrue(reader.memberships().find(tenantId, member).isPresent());
        assertThat(reader.profiles().findByMembership(adminMembership.id()))
                .hasValueSatisfying(p -> assertEquals(ProfileStatus.ACTIVE, p.status()));

        UnitOfWork deleter = store.openUnitOfWork();
        deleter.begin();
        List<Membership> removed = deleter.memberships().deleteForUser(admin);
        removed.forEach(m -> deleter.profiles().deleteByMembership(m.id()));
        deleter.commit();

        assertEquals(1, removed.size());
        assertEquals(0, store.openUnitOfWork().memberships().countWithRole(tenantId, TenantRole.ORG_ADMIN));
        assertTrue(store.committedProfiles().isEmpty());
    }

    @Test
    void testProfileUpdateStagedUntilCommit() {
        Profile profile = Profile.active(UUID.randomUUID(), "Eve", "Example", NOW);
        UnitOfWork setup = store.openUnitOfWork();
        setup.begin();
        setup.profiles().add(profile);
        setup.commit();

        UnitOfWork uow = store.openUnitOfWork();
        uow.begin();
        uow.profiles().update(profile.deactivated(NOW.plusSeconds(60)));

        assertEquals(ProfileStatus.ACTIVE, store.committedProfiles().get(0).status());
        uow.commit();
        assertEquals(ProfileStatus.INACTIVE, store.committedProfiles().get(0).status());
        assertEquals(NOW.plusSeconds(60), store.committedProfiles().get(0).inactiveAt());
    }

    @Test
    void testUpdatingUnknownProfileFails() {
        UnitOfWork uow = store.openUnitOfWork();
        uow.begin();
        assertThrows(StoreException.class,
                () -> uow.profiles().update(Profile.active(UUID.randomUUID(), "No", "One", NOW)));
    }
}
