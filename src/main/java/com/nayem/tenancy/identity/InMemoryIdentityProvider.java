package com.nayem.tenancy.identity;

import com.nayem.tenancy.saga.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link IdentityProviderClient}.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Demonstrations without a running provider
 * </p>
 * <p>
 * Mirrors the provider's conflict rules: duplicate emails, duplicate
 * organization domains and repeated memberships are rejected with status 409.
 * Every call fails fast once the caller's signal is cancelled.
 * </p>
 */
public class InMemoryIdentityProvider implements IdentityProviderClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIdentityProvider.class);

    private final Map<String, ExternalUser> users = new ConcurrentHashMap<>();
    private final Map<String, ExternalOrganization> organizations = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();
    private final Set<String> credentialResetRequired = ConcurrentHashMap.newKeySet();
    private final List<RegistrationEvent> events = new CopyOnWriteArrayList<>();
    private final List<String> passwordSetupEmails = new CopyOnWriteArrayList<>();
    private final List<String> revokedSessions = new CopyOnWriteArrayList<>();

    @Override
    public synchronized ExternalUser createUser(NewExternalUser user, CancellationSignal signal) {
        signal.throwIfCancelled();
        if (findUserByEmail(user.email(), signal).isPresent()) {
            throw new IdentityProviderException(409, "User exists with same email: " + user.email());
        }
        ExternalUser created = new ExternalUser(
                UUID.randomUUID().toString(), user.username(), user.email(), user.firstName(), user.lastName());
        users.put(created.id(), created);
        if (user.credentialResetRequired()) {
            credentialResetRequired.add(created.id());
        }
        log.debug("Created provider user {} ({})", created.id(), created.email());
        return created;
    }

    @Override
    public Optional<ExternalUser> findUserByEmail(String email, CancellationSignal signal) {
        signal.throwIfCancelled();
        return users.values().stream()
                .filter(u -> u.email() != null && u.email().equalsIgnoreCase(email))
                .findFirst();
    }

    @Override
    public Optional<ExternalUser> findUserById(String externalUserId, CancellationSignal signal) {
        signal.throwIfCancelled();
        return Optional.ofNullable(users.get(externalUserId));
    }

    @Override
    public void deleteUser(String externalUserId, CancellationSignal signal) {
        signal.throwIfCancelled();
        if (users.remove(externalUserId) == null) {
            throw new ProviderResourceNotFoundException("User not found: " + externalUserId);
        }
        members.values().forEach(set -> set.remove(externalUserId));
        credentialResetRequired.remove(externalUserId);
    }

    @Override
    public void sendPasswordSetupEmail(String externalUserId, CancellationSignal signal) {
        signal.throwIfCancelled();
        requireUser(externalUserId);
        passwordSetupEmails.add(externalUserId);
    }

    @Override
    public void revokeSessions(String externalUserId, CancellationSignal signal) {
        signal.throwIfCancelled();
        requireUser(externalUserId);
        revokedSessions.add(externalUserId);
    }

    @Override
    public synchronized void createOrganization(NewOrganization organization, CancellationSignal signal) {
        signal.throwIfCancelled();
        boolean domainTaken = organizations.values().stream()
                .anyMatch(o -> o.domains().contains(organization.domain()));
        if (domainTaken) {
            throw new IdentityProviderException(409, "Organization domain already in use: " + organization.domain());
        }
        String id = UUID.randomUUID().toString();
        organizations.put(id, new ExternalOrganization(id, organization.name(), List.of(organization.domain())));
        members.put(id, ConcurrentHashMap.newKeySet());
    }

    @Override
    public ExternalOrganization findOrganizationByDomain(String domain, CancellationSignal signal) {
        signal.throwIfCancelled();
        return organizations.values().stream()
                .filter(o -> o.domains().contains(domain))
                .findFirst()
                .orElseThrow(() -> new ProviderResourceNotFoundException("No organization for domain " + domain));
    }

    @Override
    public void addUserToOrganization(String externalUserId, String externalOrgId, CancellationSignal signal) {
        signal.throwIfCancelled();
        requireUser(externalUserId);
        Set<String> orgMembers = members.get(externalOrgId);
        if (orgMembers == null) {
            throw new ProviderResourceNotFoundException("Organization not found: " + externalOrgId);
        }
        if (!orgMembers.add(externalUserId)) {
            throw new IdentityProviderException(409,
                    "User " + externalUserId + " is already a member of organization " + externalOrgId);
        }
    }

    @Override
    public void removeUserFromOrganization(String externalUserId, String externalOrgId, CancellationSignal signal) {
        signal.throwIfCancelled();
        Set<String> orgMembers = members.get(externalOrgId);
        if (orgMembers == null || !orgMembers.remove(externalUserId)) {
            throw new ProviderResourceNotFoundException(
                    "User " + externalUserId + " is not a member of organization " + externalOrgId);
        }
    }

    @Override
    public void deleteOrganization(String externalOrgId, CancellationSignal signal) {
        signal.throwIfCancelled();
        if (organizations.remove(externalOrgId) == null) {
            throw new ProviderResourceNotFoundException("Organization not found: " + externalOrgId);
        }
        members.remove(externalOrgId);
    }

    @Override
    public List<RegistrationEvent> listRecentRegistrationEvents(Instant since, CancellationSignal signal) {
        signal.throwIfCancelled();
        return events.stream()
                .filter(e -> e.timestamp() == null || !e.timestamp().isBefore(since))
                .sorted(Comparator.comparing(RegistrationEvent::timestamp,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Records a registration event as if a user had registered directly with the provider.
     */
    public void publishRegistration(RegistrationEvent event) {
        events.add(event);
    }

    /**
     * Registers an already existing user, bypassing conflict checks. Useful for testing.
     */
    public ExternalUser seedUser(ExternalUser user) {
        users.put(user.id(), user);
        return user;
    }

    public boolean isMember(String externalUserId, String externalOrgId) {
        Set<String> orgMembers = members.get(externalOrgId);
        return orgMembers != null && orgMembers.contains(externalUserId);
    }

    public boolean requiresCredentialReset(String externalUserId) {
        return credentialResetRequired.contains(externalUserId);
    }

    public List<ExternalUser> users() {
        return new ArrayList<>(users.values());
    }

    public List<ExternalOrganization> organizations() {
        return new ArrayList<>(organizations.values());
    }

    public List<String> passwordSetupEmails() {
        return List.copyOf(passwordSetupEmails);
    }

    public List<String> revokedSessions() {
        return List.copyOf(revokedSessions);
    }

    private void requireUser(String externalUserId) {
        if (!users.containsKey(externalUserId)) {
            throw new ProviderResourceNotFoundException("User not found: " + externalUserId);
        }
    }
}
