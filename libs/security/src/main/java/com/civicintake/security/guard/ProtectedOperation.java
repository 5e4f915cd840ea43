package com.civicintake.security.guard;

import com.civicintake.security.Principal;

/**
 * The work behind a guard. Runs only once the caller has passed authentication and the access
 * rule, and at most once per request.
 */
@FunctionalInterface
public interface ProtectedOperation<T> {

    /**
     * @param principal the verified caller; null only under optional authentication
     */
    T apply(GuardRequest request, Principal principal);
}
