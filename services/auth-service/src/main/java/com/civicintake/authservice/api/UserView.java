package com.civicintake.authservice.api;

import com.civicintake.authservice.domain.UserAccount;
import com.civicintake.security.Principal;

/**
 * Public view of an account or principal.
 */
public record UserView(String id, String name, String email, String role) {

    public static UserView of(Principal principal) {
        return new UserView(principal.id(), principal.name(), principal.email(), principal.role());
    }

    public static UserView of(UserAccount account) {
        return new UserView(account.id(), account.name(), account.email(), account.role().name());
    }
}
