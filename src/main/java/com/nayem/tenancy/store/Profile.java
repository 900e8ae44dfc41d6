package com.nayem.tenancy.store;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-tenant profile of a member.
 *
 * @param inactiveAt Set when the profile was deactivated, otherwise null
 */
public record Profile(
        UUID id,
        UUID membershipId,
        String firstName,
        String lastName,
        ProfileStatus status,
        Instant createdAt,
        Instant inactiveAt) {

    public static Profile active(UUID membershipId, String firstName, String lastName, Instant now) {
        return new Profile(UUID.randomUUID(), membershipId, firstName, lastName, ProfileStatus.ACTIVE, now, null);
    }

    public Profile deactivated(Instant at) {
        return new Profile(id, membershipId, firstName, lastName, ProfileStatus.INACTIVE, createdAt, at);
    }
}
