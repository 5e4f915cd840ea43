package com.civicintake.security;

import com.civicintake.security.catalog.Role;

import java.util.Optional;

/**
 * Authenticated identity as captured in an access credential at issuance time.
 * <p>
 * The role is kept as the raw string carried by the credential. It is resolved against the
 * catalog only when a decision is made, so a credential naming a role the catalog does not know
 * still authenticates and is then refused with {@link AuthErrorCode#INVALID_ROLE}.
 *
 * @param id    stable account identifier (the credential subject)
 * @param email account email
 * @param name  display name
 * @param role  role name as issued
 */
public record Principal(String id, String email, String name, String role) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
    }

    /**
     * Convenience constructor for callers holding a catalog role.
     */
    public Principal(String id, String email, String name, Role role) {
        this(id, email, name, role.name());
    }

    /**
     * The catalog role this principal's role string names, if any.
     */
    public Optional<Role> knownRole() {
        return Role.fromValue(role);
    }
}
