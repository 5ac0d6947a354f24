package com.decoadmin.backend.modules.organization.domain;

import java.util.UUID;

public record OrganizationSummary(UUID id, String name, String slug, String avatarUrl) {
}
