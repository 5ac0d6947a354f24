package com.decoadmin.backend.modules.organization.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Decides which organizations admit an email domain. Exact, case-insensitive
 * equality only: {@code eng.acme.com} does not match {@code @acme.com}.
 */
public final class DomainMatcher {

    private DomainMatcher() {
    }

    public static List<UUID> findJoinable(String emailDomain, Collection<DomainPolicy> policies) {
        if (emailDomain == null || emailDomain.isBlank() || policies == null || policies.isEmpty()) {
            return List.of();
        }
        String domain = emailDomain.trim().toLowerCase(Locale.ROOT);
        Set<UUID> matched = new LinkedHashSet<>();
        for (DomainPolicy policy : policies) {
            if (admits(policy, domain)) {
                matched.add(policy.organizationId());
            }
        }
        return new ArrayList<>(matched);
    }

    public static boolean admits(DomainPolicy policy, String emailDomain) {
        if (policy == null || !policy.open() || emailDomain == null || emailDomain.isBlank()) {
            return false;
        }
        String domain = emailDomain.trim().toLowerCase(Locale.ROOT);
        return policy.domains().stream().anyMatch(entry -> EmailDomains.entryMatches(entry, domain));
    }
}
