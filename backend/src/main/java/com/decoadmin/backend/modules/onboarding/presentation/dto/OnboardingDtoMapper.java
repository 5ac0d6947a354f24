package com.decoadmin.backend.modules.onboarding.presentation.dto;

import java.util.List;

import com.decoadmin.backend.modules.onboarding.application.JoinableOrganization;
import com.decoadmin.backend.modules.onboarding.application.OnboardingState;
import com.decoadmin.backend.modules.onboarding.domain.ProfileState;
import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;

public final class OnboardingDtoMapper {

    private OnboardingDtoMapper() {
    }

    public static OnboardingStateResponse toStateResponse(OnboardingState state) {
        return new OnboardingStateResponse(
                state.stage(),
                state.profile() == null ? null : toProfileResponse(state.profile()),
                toJoinableResponses(state.joinableOrganizations()),
                state.destination() == null ? null : toOrganizationResponse(state.destination())
        );
    }

    public static ProfileResponse toProfileResponse(ProfileState profile) {
        return new ProfileResponse(
                profile.answers().role(),
                profile.answers().companySize(),
                profile.answers().useCase(),
                profile.completedAt(),
                profile.destinationOrganizationId()
        );
    }

    public static List<JoinableOrganizationResponse> toJoinableResponses(List<JoinableOrganization> organizations) {
        return organizations.stream()
                .map(joinable -> new JoinableOrganizationResponse(
                        joinable.organization().id(),
                        joinable.organization().name(),
                        joinable.organization().slug(),
                        joinable.organization().avatarUrl(),
                        joinable.memberCount(),
                        joinable.sampleMemberIds()))
                .toList();
    }

    public static OrganizationResponse toOrganizationResponse(OrganizationSummary organization) {
        return new OrganizationResponse(organization.id(), organization.name(), organization.slug(), organization.avatarUrl());
    }
}
