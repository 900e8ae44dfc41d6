package com.nayem.tenancy.store;

import java.time.Instant;
import java.util.UUID;

/**
 * Internal user record. The id is generated locally and never equals a
 * provider-issued id.
 */
public record User(UUID id, String email, Instant createdAt) {
}
