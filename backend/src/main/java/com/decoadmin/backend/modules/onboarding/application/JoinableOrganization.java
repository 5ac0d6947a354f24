package com.decoadmin.backend.modules.onboarding.application;

import java.util.List;
import java.util.UUID;

import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;

public record JoinableOrganization(OrganizationSummary organization, long memberCount, List<UUID> sampleMemberIds) {
}
