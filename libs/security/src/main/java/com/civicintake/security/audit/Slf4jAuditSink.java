package com.civicintake.security.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes events to the {@code AUDIT} logger, allowed decisions at INFO and denials at WARN, so
 * log routing can send them to their own appender.
 */
public final class Slf4jAuditSink implements AuditSink {

    /** Name of the logger audit lines are written to. */
    public static final String LOGGER_NAME = "AUDIT";

    private static final String FORMAT =
            "{} action={} actor={} role={} requirement={} endpoint={} {} reason=\"{}\" metadata={}";

    private final Logger logger;

    public Slf4jAuditSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    Slf4jAuditSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void append(AuditEvent event) {
        Object[] args = {
                event.decision(),
                event.action(),
                event.actorEmail() != null ? event.actorEmail() : orAnonymous(event.actorId()),
                event.actorRole() != null ? event.actorRole() : "none",
                event.requirement(),
                event.method(),
                event.endpoint(),
                event.reason(),
                event.metadata()
        };
        if (event.allowed()) {
            logger.info(FORMAT, args);
        } else {
            logger.warn(FORMAT, args);
        }
    }

    private static String orAnonymous(String actorId) {
        return actorId != null ? actorId : "anonymous";
    }
}
