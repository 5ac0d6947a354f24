package com.decoadmin.backend.modules.onboarding.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Snapshot of a stored onboarding profile. {@code completedAt == null} means onboarding is still open.
 */
public record ProfileState(
        UUID userId,
        ProfileAnswers answers,
        OffsetDateTime completedAt,
        UUID destinationOrganizationId
) {

    public boolean isCompleted() {
        return completedAt != null;
    }
}
