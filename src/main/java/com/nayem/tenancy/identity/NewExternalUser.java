package com.nayem.tenancy.identity;

/**
 * Request to create a user in the identity provider.
 *
 * @param username               Login name
 * @param email                  Email address
 * @param firstName              Given name
 * @param lastName               Family name
 * @param password               Initial password, or null for invitations
 * @param credentialResetRequired Whether the user must set a new password on next login
 */
public record NewExternalUser(
        String username,
        String email,
        String firstName,
        String lastName,
        String password,
        boolean credentialResetRequired) {

    public static NewExternalUser withPassword(String email, String firstName, String lastName, String password) {
        return new NewExternalUser(email, email, firstName, lastName, password, false);
    }

    /**
     * A password-less user who will set credentials through an emailed link.
     */
    public static NewExternalUser invitation(String email, String firstName, String lastName) {
        return new NewExternalUser(email, email, firstName, lastName, null, true);
    }

    /**
     * Re-creation of a deleted user from a snapshot. The original credentials
     * are gone, so the restored account must reset them.
     */
    public static NewExternalUser restoreFrom(ExternalUser snapshot) {
        return new NewExternalUser(
                snapshot.username() != null ? snapshot.username() : snapshot.email(),
                snapshot.email(),
                snapshot.firstName() != null ? snapshot.firstName() : "",
                snapshot.lastName() != null ? snapshot.lastName() : "",
                null,
                true);
    }

    @Override
    public String toString() {
        return "NewExternalUser[username=" + username + ", email=" + email
                + ", credentialResetRequired=" + credentialResetRequired + "]";
    }
}
