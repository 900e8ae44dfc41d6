package com.nayem.tenancy.store;

import java.time.Instant;
import java.util.UUID;

/**
 * Links a locally generated id to the id the identity provider issued for the
 * same entity. {@code (providerId, externalId)} is unique.
 */
public record ExternalIdentityMapping(
        UUID id,
        UUID internalId,
        String externalId,
        EntityKind entityKind,
        UUID providerId,
        Instant createdAt) {

    public static ExternalIdentityMapping create(UUID internalId, String externalId, EntityKind kind,
            UUID providerId, Instant now) {
        return new ExternalIdentityMapping(UUID.randomUUID(), internalId, externalId, kind, providerId, now);
    }
}
