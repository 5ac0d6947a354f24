package com.decoadmin.backend.modules.onboarding.presentation.dto;

import java.util.List;

import com.decoadmin.backend.modules.onboarding.domain.OnboardingStage;

public record OnboardingStateResponse(
        OnboardingStage stage,
        ProfileResponse profile,
        List<JoinableOrganizationResponse> joinableOrganizations,
        OrganizationResponse destination
) {
}
