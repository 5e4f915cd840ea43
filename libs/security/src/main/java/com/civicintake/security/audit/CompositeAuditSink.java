package com.civicintake.security.audit;

import java.util.List;

/**
 * Fans every event out to several sinks.
 * <p>
 * Each sink gets the event even if an earlier one failed; the first failure is rethrown
 * afterwards with later ones attached as suppressed exceptions.
 */
public final class CompositeAuditSink implements AuditSink {

    private final List<AuditSink> sinks;

    public CompositeAuditSink(List<AuditSink> sinks) {
        if (sinks == null || sinks.isEmpty()) {
            throw new IllegalArgumentException("at least one sink is required");
        }
        this.sinks = List.copyOf(sinks);
    }

    public static CompositeAuditSink of(AuditSink... sinks) {
        return new CompositeAuditSink(List.of(sinks));
    }

    @Override
    public void append(AuditEvent event) {
        RuntimeException failure = null;
        for (AuditSink sink : sinks) {
            try {
                sink.append(event);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public List<AuditSink> sinks() {
        return sinks;
    }
}
