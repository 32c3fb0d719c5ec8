package com.bluequee.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters with a consistent tag set.
 *
 * <p>Every meter carries {@code service}; meters created while a {@link CorrelationContext} with an
 * organization is bound also carry {@code organization}, so per-clinic dashboards need no extra
 * wiring. Micrometer caches meters by name and tags, so calling these per request is cheap.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_ORGANIZATION = "organization";

    /** Tag value used when no organization is bound. */
    public static final String NO_ORGANIZATION = "none";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry the Micrometer meter registry
     * @param serviceName logical service name included as a tag on every meter
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
     * Returns the counter for the given name and extra tags (key-value pairs).
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(baseTags(tags)).register(registry);
    }

    /**
     * Returns the timer for the given name and extra tags (key-value pairs).
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(baseTags(tags)).register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        String organization =
                CorrelationContextHolder.get()
                        .map(CorrelationContext::organizationId)
                        .map(String::valueOf)
                        .orElse(NO_ORGANIZATION);
        Tags tags = Tags.of(TAG_SERVICE, serviceName, TAG_ORGANIZATION, organization);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
