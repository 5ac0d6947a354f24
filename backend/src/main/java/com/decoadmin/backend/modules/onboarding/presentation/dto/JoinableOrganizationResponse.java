package com.decoadmin.backend.modules.onboarding.presentation.dto;

import java.util.List;
import java.util.UUID;

public record JoinableOrganizationResponse(
        UUID id,
        String name,
        String slug,
        String avatarUrl,
        long memberCount,
        List<UUID> sampleMemberIds
) {
}
