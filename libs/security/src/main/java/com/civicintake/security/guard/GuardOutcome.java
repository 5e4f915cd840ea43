package com.civicintake.security.guard;

import com.civicintake.security.Principal;

import java.util.function.Function;

/**
 * Result of running a guarded handler: either the operation ran, or the guard refused.
 *
 * @param <T> value produced by the wrapped operation
 */
public sealed interface GuardOutcome<T> permits GuardOutcome.Allowed, GuardOutcome.Rejected {

    static <T> GuardOutcome<T> allowed(Principal principal, T value) {
        return new Allowed<>(principal, value);
    }

    static <T> GuardOutcome<T> rejected(GuardRejection rejection) {
        return new Rejected<>(rejection);
    }

    boolean isAllowed();

    /**
     * Collapses the outcome into one value, typically a transport response.
     */
    <R> R fold(Function<Allowed<T>, R> onAllowed, Function<GuardRejection, R> onRejected);

    /**
     * The operation ran.
     *
     * @param principal the verified caller, null under optional authentication without a credential
     * @param value     what the operation returned
     */
    record Allowed<T>(Principal principal, T value) implements GuardOutcome<T> {

        @Override
        public boolean isAllowed() {
            return true;
        }

        @Override
        public <R> R fold(Function<Allowed<T>, R> onAllowed, Function<GuardRejection, R> onRejected) {
            return onAllowed.apply(this);
        }
    }

    /**
     * The guard refused; the operation was not invoked.
     */
    record Rejected<T>(GuardRejection rejection) implements GuardOutcome<T> {

        public Rejected {
            if (rejection == null) {
                throw new IllegalArgumentException("rejection must not be null");
            }
        }

        @Override
        public boolean isAllowed() {
            return false;
        }

        @Override
        public <R> R fold(Function<Allowed<T>, R> onAllowed, Function<GuardRejection, R> onRejected) {
            return onRejected.apply(rejection);
        }
    }
}
