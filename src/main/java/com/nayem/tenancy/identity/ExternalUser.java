package com.nayem.tenancy.identity;

/**
 * A user as the identity provider reports it.
 *
 * @param id        Provider-issued identifier
 * @param username  Login name
 * @param email     Email address
 * @param firstName Given name, may be empty
 * @param lastName  Family name, may be empty
 */
public record ExternalUser(
        String id,
        String username,
        String email,
        String firstName,
        String lastName) {
}
