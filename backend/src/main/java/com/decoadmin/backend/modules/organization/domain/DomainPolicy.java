package com.decoadmin.backend.modules.organization.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Read-only view of an organization's domain policy, as consumed by {@link DomainMatcher}.
 */
public record DomainPolicy(UUID organizationId, List<String> domains, boolean open) {

    public DomainPolicy {
        Objects.requireNonNull(organizationId, "organizationId is required");
        domains = domains == null ? List.of() : List.copyOf(domains);
    }
}
