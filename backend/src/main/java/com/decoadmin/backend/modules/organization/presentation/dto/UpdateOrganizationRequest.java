package com.decoadmin.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateOrganizationRequest(
        @NotBlank @Size(max = 120) String name,
        @Size(max = 2048) String companyUrl,
        boolean allowDomainJoin
) {
}
