package com.nayem.tenancy.store;

import java.util.Optional;
import java.util.UUID;

public interface ProfileRepository {

    void add(Profile profile);

    void update(Profile profile);

    Optional<Profile> findByMembership(UUID membershipId);

    void deleteByMembership(UUID membershipId);
}
