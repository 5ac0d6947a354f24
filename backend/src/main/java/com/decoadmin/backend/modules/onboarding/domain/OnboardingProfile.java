package com.decoadmin.backend.modules.onboarding.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.decoadmin.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * One row per user, keyed by the identity provider's user id.
 */
@Entity
@Table(name = "onboarding_profile")
public class OnboardingProfile extends AbstractTimestampedEntity {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private ProfileRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "company_size", nullable = false, length = 32)
    private CompanySize companySize;

    @Enumerated(EnumType.STRING)
    @Column(name = "use_case", nullable = false, length = 32)
    private UseCase useCase;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "destination_organization_id", columnDefinition = "uuid")
    private UUID destinationOrganizationId;

    protected OnboardingProfile() {
    }

    public UUID getUserId() {
        return userId;
    }

    public ProfileRole getRole() {
        return role;
    }

    public CompanySize getCompanySize() {
        return companySize;
    }

    public UseCase getUseCase() {
        return useCase;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public UUID getDestinationOrganizationId() {
        return destinationOrganizationId;
    }

    public ProfileState toState() {
        return new ProfileState(userId, new ProfileAnswers(role, companySize, useCase), completedAt, destinationOrganizationId);
    }
}
