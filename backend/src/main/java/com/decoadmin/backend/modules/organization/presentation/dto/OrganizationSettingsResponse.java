package com.decoadmin.backend.modules.organization.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.decoadmin.backend.modules.organization.application.OrganizationSettings;

public record OrganizationSettingsResponse(
        UUID id,
        String name,
        String slug,
        String avatarUrl,
        boolean allowDomainJoin,
        List<String> allowedDomains
) {

    public static OrganizationSettingsResponse from(OrganizationSettings settings) {
        return new OrganizationSettingsResponse(
                settings.organization().id(),
                settings.organization().name(),
                settings.organization().slug(),
                settings.organization().avatarUrl(),
                settings.allowDomainJoin(),
                settings.allowedDomains()
        );
    }
}
