package com.decoadmin.backend.modules.organization.domain;

import java.util.List;
import java.util.UUID;

/**
 * Member count plus a few member ids for the "join your team" card.
 */
public record MemberSummary(UUID organizationId, long memberCount, List<UUID> sampleMemberIds) {

    public static MemberSummary empty(UUID organizationId) {
        return new MemberSummary(organizationId, 0, List.of());
    }
}
