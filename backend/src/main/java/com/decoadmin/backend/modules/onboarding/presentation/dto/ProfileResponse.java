package com.decoadmin.backend.modules.onboarding.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.decoadmin.backend.modules.onboarding.domain.CompanySize;
import com.decoadmin.backend.modules.onboarding.domain.ProfileRole;
import com.decoadmin.backend.modules.onboarding.domain.UseCase;

public record ProfileResponse(
        ProfileRole role,
        CompanySize companySize,
        UseCase useCase,
        OffsetDateTime completedAt,
        UUID destinationOrganizationId
) {
}
