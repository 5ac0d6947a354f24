package com.decoadmin.backend.modules.organization.presentation.dto;

import java.util.UUID;

import com.decoadmin.backend.modules.onboarding.application.OrganizationDestination;

public record OrganizationDestinationResponse(UUID organizationId, String slug, String name, boolean alreadyMember) {

    public static OrganizationDestinationResponse from(OrganizationDestination destination) {
        return new OrganizationDestinationResponse(
                destination.organizationId(),
                destination.slug(),
                destination.name(),
                destination.alreadyMember()
        );
    }
}
