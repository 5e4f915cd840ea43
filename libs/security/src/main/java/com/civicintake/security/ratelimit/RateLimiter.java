package com.civicintake.security.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter keyed by caller identifier (usually the client address).
 * <p>
 * The first request for an identifier opens a window of the given length; within it at most
 * {@code maxRequests} calls are allowed. Once the window has passed the next call opens a fresh
 * one. Windows are only ever replaced atomically, so concurrent callers never lose a count.
 * Expired windows stay in memory until {@link #sweepExpired()} runs.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimiter(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    /**
     * Counts one request for {@code identifier}.
     *
     * @return true if the request is within the limit
     */
    public boolean allow(String identifier, int maxRequests, Duration window) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier must not be null");
        }
        if (maxRequests <= 0 || window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("maxRequests and window must be positive");
        }
        Instant now = clock.instant();
        Window current = windows.compute(identifier, (key, existing) ->
                existing == null || existing.expiredAt(now)
                        ? new Window(1, now.plus(window))
                        : new Window(existing.count() + 1, existing.resetAt()));
        boolean allowed = current.count() <= maxRequests;
        if (!allowed && current.count() == maxRequests + 1) {
            log.info("Rate limit reached for {}: {} requests per {}, resets at {}",
                    identifier, maxRequests, window, current.resetAt());
        }
        return allowed;
    }

    /**
     * When the current window for {@code identifier} resets, if one is open.
     */
    public Optional<Instant> resetAt(String identifier) {
        Window window = windows.get(identifier);
        if (window == null || window.expiredAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(window.resetAt());
    }

    /**
     * Drops every window that has passed.
     *
     * @return how many were removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Window> entry : windows.entrySet()) {
            if (entry.getValue().expiredAt(now) && windows.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired rate-limit windows, {} remain", removed, windows.size());
        }
        return removed;
    }

    /** Number of tracked identifiers, expired windows included. */
    public int size() {
        return windows.size();
    }

    private record Window(int count, Instant resetAt) {

        boolean expiredAt(Instant now) {
            return !now.isBefore(resetAt);
        }
    }
}
