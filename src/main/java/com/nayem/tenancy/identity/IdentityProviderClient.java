package com.nayem.tenancy.identity;

import com.nayem.tenancy.saga.CancellationSignal;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Capability interface over the external identity provider.
 * <p>
 * Implementations are stateless per call; the only thing shared between
 * calls is the service credential. Failures surface as
 * {@link IdentityProviderException}; a missing resource as
 * {@link ProviderResourceNotFoundException}.
 * </p>
 * <p>
 * Every operation takes the caller's {@link CancellationSignal}. An
 * implementation must not block past its deadline: a remote client bounds the
 * request by {@link CancellationSignal#remaining()} and fails with
 * {@link java.util.concurrent.CancellationException} once the signal is
 * cancelled. The single-argument overloads run without a deadline.
 * </p>
 */
public interface IdentityProviderClient {

    /**
     * @return the created user, including its provider-issued id
     * @throws IdentityProviderException with status 409 if the email is taken
     */
    ExternalUser createUser(NewExternalUser user, CancellationSignal signal);

    Optional<ExternalUser> findUserByEmail(String email, CancellationSignal signal);

    Optional<ExternalUser> findUserById(String externalUserId, CancellationSignal signal);

    /**
     * @throws ProviderResourceNotFoundException if the user does not exist
     */
    void deleteUser(String externalUserId, CancellationSignal signal);

    void sendPasswordSetupEmail(String externalUserId, CancellationSignal signal);

    /**
     * Logs the user out of every active session.
     */
    void revokeSessions(String externalUserId, CancellationSignal signal);

    /**
     * @throws IdentityProviderException with status 409 if the domain is taken
     */
    void createOrganization(NewOrganization organization, CancellationSignal signal);

    /**
     * @throws ProviderResourceNotFoundException if no organization owns the domain
     */
    ExternalOrganization findOrganizationByDomain(String domain, CancellationSignal signal);

    /**
     * @throws IdentityProviderException with status 409 if the user is already a member
     */
    void addUserToOrganization(String externalUserId, String externalOrgId, CancellationSignal signal);

    /**
     * @throws ProviderResourceNotFoundException if the user is not a member
     */
    void removeUserFromOrganization(String externalUserId, String externalOrgId, CancellationSignal signal);

    /**
     * @throws ProviderResourceNotFoundException if the organization does not exist
     */
    void deleteOrganization(String externalOrgId, CancellationSignal signal);

    /**
     * Registration events that occurred at or after {@code since}.
     */
    List<RegistrationEvent> listRecentRegistrationEvents(Instant since, CancellationSignal signal);

    default ExternalUser createUser(NewExternalUser user) {
        return createUser(user, CancellationSignal.none());
    }

    default Optional<ExternalUser> findUserByEmail(String email) {
        return findUserByEmail(email, CancellationSignal.none());
    }

    default Optional<ExternalUser> findUserById(String externalUserId) {
        return findUserById(externalUserId, CancellationSignal.none());
    }

    default void deleteUser(String externalUserId) {
        deleteUser(externalUserId, CancellationSignal.none());
    }

    default void sendPasswordSetupEmail(String externalUserId) {
        sendPasswordSetupEmail(externalUserId, CancellationSignal.none());
    }

    default void revokeSessions(String externalUserId) {
        revokeSessions(externalUserId, CancellationSignal.none());
    }

    default void createOrganization(NewOrganization organization) {
        createOrganization(organization, CancellationSignal.none());
    }

    default ExternalOrganization findOrganizationByDomain(String domain) {
        return findOrganizationByDomain(domain, CancellationSignal.none());
    }

    default void addUserToOrganization(String externalUserId, String externalOrgId) {
        addUserToOrganization(externalUserId, externalOrgId, CancellationSignal.none());
    }

    default void removeUserFromOrganization(String externalUserId, String externalOrgId) {
        removeUserFromOrganization(externalUserId, externalOrgId, CancellationSignal.none());
    }

    default void deleteOrganization(String externalOrgId) {
        deleteOrganization(externalOrgId, CancellationSignal.none());
    }

    default List<RegistrationEvent> listRecentRegistrationEvents(Instant since) {
        return listRecentRegistrationEvents(since, CancellationSignal.none());
    }
}
