package com.civicintake.security;

import java.util.Optional;

/**
 * Source of current principal data, consulted when a refresh credential is exchanged so the new
 * access credential reflects the account's present role and name.
 * <p>
 * Implementations may block on I/O.
 */
@FunctionalInterface
public interface PrincipalStore {

    /**
     * @return the principal for the id, or empty if the account no longer exists
     */
    Optional<Principal> findById(String id);
}
