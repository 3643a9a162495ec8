package com.chartgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meters are registered lazily and cached by the registry, so calling {@link #counter} with the
 * same name and tags twice returns the same counter. Tag values must come from small closed sets
 * (rejection reasons, auth sources); never tag with tenant IDs or credentials.
 */
public final class MetricFactory {

    /** Tag key for the service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the meter registry (Prometheus in production, simple registry in tests)
     * @param serviceName logical service name applied to every meter
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
     * Returns the counter for the given name and extra tags.
     *
     * @param tags additional tags as alternating key/value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tagsWithService(tags))
                .register(registry);
    }

    /**
     * Returns the timer for the given name and extra tags.
     *
     * @param tags additional tags as alternating key/value pairs
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tagsWithService(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tagsWithService(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs");
        }
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        return extraTags.length > 0 ? tags.and(extraTags) : tags;
    }
}
