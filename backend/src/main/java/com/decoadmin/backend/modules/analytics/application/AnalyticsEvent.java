package com.decoadmin.backend.modules.analytics.application;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Product analytics event. Property values may be null; they are kept in insertion order.
 */
public record AnalyticsEvent(String name, UUID userId, Map<String, Object> properties, OffsetDateTime occurredAt) {

    public static final String ONBOARDING_COMPLETED = "onboarding_completed";
    public static final String ORGANIZATION_CREATED = "organization_created";
    public static final String ORGANIZATION_JOINED = "organization_joined";

    public AnalyticsEvent {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(occurredAt, "occurredAt");
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
