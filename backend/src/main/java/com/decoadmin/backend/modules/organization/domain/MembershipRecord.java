package com.decoadmin.backend.modules.organization.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public record MembershipRecord(UUID userId, UUID organizationId, MembershipRole role, OffsetDateTime joinedAt) {
}
