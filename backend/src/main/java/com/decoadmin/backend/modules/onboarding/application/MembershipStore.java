package com.decoadmin.backend.modules.onboarding.application;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.decoadmin.backend.global.error.RepositoryUnavailableException;
import com.decoadmin.backend.modules.onboarding.domain.ProfileAnswers;
import com.decoadmin.backend.modules.onboarding.domain.ProfileState;
import com.decoadmin.backend.modules.organization.domain.DomainPolicy;
import com.decoadmin.backend.modules.organization.domain.MemberSummary;
import com.decoadmin.backend.modules.organization.domain.MembershipRecord;
import com.decoadmin.backend.modules.organization.domain.MembershipRole;
import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;

/**
 * Persistence boundary of the onboarding flow. Every method runs in its own
 * transaction; uniqueness is enforced by the store and reported through the
 * conflict exceptions below. Connectivity failures surface as
 * {@link RepositoryUnavailableException}.
 */
public interface MembershipStore {

    Optional<ProfileState> findProfile(UUID userId);

    /**
     * Inserts or overwrites the answers; never creates a second row and never touches completion.
     */
    ProfileState upsertProfile(UUID userId, ProfileAnswers answers);

    /**
     * Sets the completion timestamp and destination when the profile is still open.
     * On an already completed profile only a missing destination is filled in.
     *
     * @return {@code true} only for the call that actually completed onboarding
     */
    boolean markOnboardingCompleted(UUID userId, UUID destinationOrganizationId, OffsetDateTime completedAt);

    /**
     * Policies that may admit {@code emailDomain}. Implementations may pre-filter;
     * the caller re-checks each one with {@code DomainMatcher}.
     */
    List<DomainPolicy> listDomainPolicies(String emailDomain);

    Optional<DomainPolicy> findDomainPolicy(UUID organizationId);

    Optional<OrganizationSummary> findOrganization(UUID organizationId);

    List<OrganizationSummary> findOrganizations(Collection<UUID> organizationIds);

    Optional<OrganizationSummary> findOrganizationByCreationKey(UUID creatorUserId, String creationKey);

    /**
     * @throws MembershipConflictException when (user, organization) already has a membership
     */
    MembershipRecord insertMembership(UUID userId, UUID organizationId, MembershipRole role);

    /**
     * Creates the organization and the creator's ADMIN membership atomically.
     *
     * @param creationKey optional client idempotency key, unique per creator
     * @throws SlugConflictException        when the slug is taken
     * @throws CreationKeyConflictException when the creator already used {@code creationKey}
     */
    OrganizationSummary insertOrganization(String name, String slug, UUID creatorUserId, String creationKey);

    boolean hasMembership(UUID userId, UUID organizationId);

    Optional<MembershipRecord> findMembership(UUID userId, UUID organizationId);

    Map<UUID, MemberSummary> summarizeMembers(Collection<UUID> organizationIds, int sampleSize);
}
