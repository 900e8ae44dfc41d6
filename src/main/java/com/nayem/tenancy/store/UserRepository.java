package com.nayem.tenancy.store;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository {

    void add(User user);

    Optional<User> findById(UUID id);

    Optional<User> findByEmail(String email);

    void delete(UUID id);
}
