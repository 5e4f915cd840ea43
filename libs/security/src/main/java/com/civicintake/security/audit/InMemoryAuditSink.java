package com.civicintake.security.audit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Keeps the most recent events in memory for the admin audit view.
 * <p>
 * Bounded: once {@code capacity} events are held the oldest is dropped for each new one.
 * Thread-safe.
 */
public final class InMemoryAuditSink implements AuditSink {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<AuditEvent> events;

    public InMemoryAuditSink() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryAuditSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, DEFAULT_CAPACITY));
    }

    @Override
    public synchronized void append(AuditEvent event) {
        Objects.requireNonNull(event, "event");
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    /** All held events, oldest first. */
    public synchronized List<AuditEvent> events() {
        return List.copyOf(events);
    }

    public List<AuditEvent> byDecision(AuditDecision decision) {
        return filter(event -> event.decision() == decision);
    }

    public List<AuditEvent> byActor(String actorId) {
        return filter(event -> Objects.equals(event.actorId(), actorId));
    }

    public List<AuditEvent> byAction(AuditAction action) {
        return filter(event -> event.action() == action);
    }

    public List<AuditEvent> deniedAttempts() {
        return byDecision(AuditDecision.DENIED);
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized void clear() {
        events.clear();
    }

    public synchronized AuditStatistics statistics() {
        long allowed = 0;
        Map<AuditAction, Long> byAction = new EnumMap<>(AuditAction.class);
        Map<String, Long> byRole = new TreeMap<>();
        for (AuditEvent event : events) {
            if (event.allowed()) {
                allowed++;
            }
            byAction.merge(event.action(), 1L, Long::sum);
            if (event.actorRole() != null) {
                byRole.merge(event.actorRole(), 1L, Long::sum);
            }
        }
        return new AuditStatistics(events.size(), allowed, events.size() - allowed, byAction, byRole);
    }

    private synchronized List<AuditEvent> filter(Predicate<AuditEvent> predicate) {
        return events.stream().filter(predicate).toList();
    }
}
