package com.decoadmin.backend.modules.organization.application;

import java.util.List;

import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;

public record OrganizationSettings(OrganizationSummary organization, boolean allowDomainJoin, List<String> allowedDomains) {

    public OrganizationSettings {
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
    }
}
