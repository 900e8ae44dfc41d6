package com.nayem.tenancy.identity;

import java.time.Instant;

/**
 * A registration that happened directly against the identity provider,
 * e.g. a user accepting an invitation link.
 */
public record RegistrationEvent(
        String externalUserId,
        String externalOrgId,
        String email,
        String firstName,
        String lastName,
        Instant timestamp) {
}
