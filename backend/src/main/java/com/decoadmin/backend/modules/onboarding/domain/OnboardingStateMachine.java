package com.decoadmin.backend.modules.onboarding.domain;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * NOT_STARTED -> PROFILE_COLLECTED -> AWAITING_ORG_CHOICE -> COMPLETED, with
 * PROFILE_COLLECTED -> COMPLETED when nothing is joinable at submission time.
 * Transitions only move forward; COMPLETED -> COMPLETED is an allowed no-op.
 */
public final class OnboardingStateMachine {

    private static final Map<OnboardingStage, Set<OnboardingStage>> ALLOWED = new EnumMap<>(OnboardingStage.class);

    static {
        ALLOWED.put(OnboardingStage.NOT_STARTED, EnumSet.of(OnboardingStage.PROFILE_COLLECTED));
        ALLOWED.put(OnboardingStage.PROFILE_COLLECTED,
                EnumSet.of(OnboardingStage.AWAITING_ORG_CHOICE, OnboardingStage.COMPLETED));
        ALLOWED.put(OnboardingStage.AWAITING_ORG_CHOICE,
                EnumSet.of(OnboardingStage.AWAITING_ORG_CHOICE, OnboardingStage.COMPLETED));
        ALLOWED.put(OnboardingStage.COMPLETED, EnumSet.of(OnboardingStage.COMPLETED));
    }

    private OnboardingStateMachine() {
    }

    /**
     * Stage as persisted. PROFILE_COLLECTED only exists inside a profile submission,
     * so a stored, not yet completed profile always reads as AWAITING_ORG_CHOICE.
     */
    public static OnboardingStage stageOf(Optional<ProfileState> profile) {
        if (profile.isEmpty()) {
            return OnboardingStage.NOT_STARTED;
        }
        return profile.get().isCompleted() ? OnboardingStage.COMPLETED : OnboardingStage.AWAITING_ORG_CHOICE;
    }

    public static OnboardingStage afterProfileCollected(int joinableOrganizationCount) {
        return joinableOrganizationCount > 0 ? OnboardingStage.AWAITING_ORG_CHOICE : OnboardingStage.COMPLETED;
    }

    public static boolean canTransition(OnboardingStage from, OnboardingStage to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * @return the target stage
     * @throws IllegalStateException for backward or skipping transitions
     */
    public static OnboardingStage transition(OnboardingStage from, OnboardingStage to) {
        if (!canTransition(from, to)) {
            throw new IllegalStateException("Illegal onboarding transition " + from + " -> " + to);
        }
        return to;
    }

    public static boolean allowsOrganizationChoice(OnboardingStage stage) {
        return stage == OnboardingStage.AWAITING_ORG_CHOICE || stage == OnboardingStage.COMPLETED;
    }
}
