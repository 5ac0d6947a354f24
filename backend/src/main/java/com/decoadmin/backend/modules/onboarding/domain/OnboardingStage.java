package com.decoadmin.backend.modules.onboarding.domain;

public enum OnboardingStage {
    NOT_STARTED,
    PROFILE_COLLECTED,
    AWAITING_ORG_CHOICE,
    COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
