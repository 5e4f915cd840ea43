package com.civicintake.authservice.error;

import java.time.Duration;

/** Too many credential requests from one client address. */
public class RateLimitExceededException extends ApiException {

    public static final String CODE = "RATE_LIMITED";

    private final Duration retryAfter;

    public RateLimitExceededException(Duration retryAfter) {
        super(429, CODE, "Too many requests. Please try again later.");
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
