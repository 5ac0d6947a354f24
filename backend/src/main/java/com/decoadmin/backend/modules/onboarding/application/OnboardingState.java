package com.decoadmin.backend.modules.onboarding.application;

import java.util.List;

import com.decoadmin.backend.modules.onboarding.domain.OnboardingStage;
import com.decoadmin.backend.modules.onboarding.domain.ProfileState;
import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;

/**
 * @param profile                null while NOT_STARTED
 * @param joinableOrganizations  recomputed on every read while AWAITING_ORG_CHOICE, empty otherwise
 * @param destination            set once COMPLETED through a join or create; null on the skip path
 */
public record OnboardingState(
        OnboardingStage stage,
        ProfileState profile,
        List<JoinableOrganization> joinableOrganizations,
        OrganizationSummary destination
) {

    public OnboardingState {
        joinableOrganizations = joinableOrganizations == null ? List.of() : List.copyOf(joinableOrganizations);
    }

    static OnboardingState notStarted() {
        return new OnboardingState(OnboardingStage.NOT_STARTED, null, List.of(), null);
    }
}
