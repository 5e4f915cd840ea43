package com.civicintake.authservice.domain;

import com.civicintake.security.Principal;
import com.civicintake.security.catalog.Role;
import java.time.Instant;

/**
 * A registered account. The password is only ever held as a BCrypt hash.
 *
 * @param id stable identifier, used as the credential subject
 * @param name display name
 * @param email login email, stored lower-case
 * @param phone optional E.164 phone number
 * @param passwordHash BCrypt hash of the password
 * @param role assigned role
 * @param createdAt registration time
 */
public record UserAccount(
        String id,
        String name,
        String email,
        String phone,
        String passwordHash,
        Role role,
        Instant createdAt) {

    public UserAccount {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    public Principal toPrincipal() {
        return new Principal(id, email, name, role);
    }

    public UserAccount withRole(Role newRole) {
        return new UserAccount(id, name, email, phone, passwordHash, newRole, createdAt);
    }

    @Override
    public String toString() {
        return "UserAccount[id=%s, email=%s, role=%s]".formatted(id, email, role);
    }
}
