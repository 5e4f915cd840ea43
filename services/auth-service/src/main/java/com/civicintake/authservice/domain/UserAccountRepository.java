package com.civicintake.authservice.domain;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for accounts.
 */
public interface UserAccountRepository {

    Optional<UserAccount> findById(String id);

    /** Looks an account up by email, ignoring case. */
    Optional<UserAccount> findByEmail(String email);

    List<UserAccount> findAll();

    /**
     * Stores a new account.
     *
     * @return false if an account with the same email already exists; nothing is stored then
     */
    boolean insert(UserAccount account);

    /**
     * Replaces an existing account with the same id.
     *
     * @return false if no such account exists
     */
    boolean update(UserAccount account);

    boolean deleteById(String id);
}
