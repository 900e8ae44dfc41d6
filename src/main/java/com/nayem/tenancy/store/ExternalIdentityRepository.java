package com.nayem.tenancy.store;

import java.util.Optional;
import java.util.UUID;

/**
 * Access to {@link ExternalIdentityMapping} rows.
 */
public interface ExternalIdentityRepository {

    void add(ExternalIdentityMapping mapping);

    /**
     * Find the mapping for a provider-issued id.
     *
     * @param providerId The configured identity provider
     * @param externalId The id issued by that provider
     * @return Optional containing the mapping if the entity was materialized locally
     */
    Optional<ExternalIdentityMapping> find(UUID providerId, String externalId);

    /**
     * Find the provider-side identity of a local entity.
     */
    Optional<ExternalIdentityMapping> findForEntity(EntityKind kind, UUID internalId, UUID providerId);

    void delete(UUID mappingId);
}
