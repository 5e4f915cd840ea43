package com.civicintake.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Micrometer caches meters by name and tags, so asking for the same counter twice returns the
 * same instance and callers may look meters up per event instead of holding on to them.
 */
public final class MetricFactory {

    /** Tag key carrying the logical service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    meter registry to register with
     * @param serviceName value of the {@code service} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns the counter with the given name and extra tags, creating it on first use.
     *
     * @param tags alternating tag keys and values
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(withService(tags))
                .register(registry);
    }

    /**
     * Returns the timer with the given name and extra tags, creating it on first use.
     *
     * @param tags alternating tag keys and values
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(withService(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags withService(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs");
        }
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        return extraTags.length == 0 ? tags : tags.and(extraTags);
    }
}
