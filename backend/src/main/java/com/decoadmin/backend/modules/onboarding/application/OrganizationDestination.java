package com.decoadmin.backend.modules.onboarding.application;

import java.util.UUID;

import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;

/**
 * Where the client navigates after a join or create. {@code alreadyMember} marks an
 * idempotent replay (duplicate join, or create retried with the same idempotency key).
 */
public record OrganizationDestination(UUID organizationId, String slug, String name, boolean alreadyMember) {

    static OrganizationDestination of(OrganizationSummary organization, boolean alreadyMember) {
        return new OrganizationDestination(organization.id(), organization.slug(), organization.name(), alreadyMember);
    }
}
