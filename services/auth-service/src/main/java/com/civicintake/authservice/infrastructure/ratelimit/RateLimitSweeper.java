package com.civicintake.authservice.infrastructure.ratelimit;

import com.civicintake.security.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired rate-limit windows.
 */
@Component
public class RateLimitSweeper {

    private static final Logger log = LoggerFactory.getLogger(RateLimitSweeper.class);

    private final RateLimiter rateLimiter;

    public RateLimitSweeper(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(
            fixedDelayString = "${civic.auth.rate-limit.sweep-interval-ms:300000}",
            initialDelayString = "${civic.auth.rate-limit.sweep-interval-ms:300000}")
    public void sweep() {
        int removed = rateLimiter.sweepExpired();
        log.debug("Rate-limit sweep removed {} windows, {} tracked", removed, rateLimiter.size());
    }
}
