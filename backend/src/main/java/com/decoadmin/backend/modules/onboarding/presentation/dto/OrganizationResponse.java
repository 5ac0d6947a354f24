package com.decoadmin.backend.modules.onboarding.presentation.dto;

import java.util.UUID;

public record OrganizationResponse(UUID id, String name, String slug, String avatarUrl) {
}
