package com.civicintake.security.guard;

/**
 * A guarded entry point. Every guard variant produces one of these.
 */
@FunctionalInterface
public interface GuardHandler<T> {

    GuardOutcome<T> handle(GuardRequest request);
}
