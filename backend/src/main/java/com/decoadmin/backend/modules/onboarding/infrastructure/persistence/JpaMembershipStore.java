package com.decoadmin.backend.modules.onboarding.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.decoadmin.backend.global.error.RepositoryUnavailableException;
import com.decoadmin.backend.modules.onboarding.application.CreationKeyConflictException;
import com.decoadmin.backend.modules.onboarding.application.MembershipConflictException;
import com.decoadmin.backend.modules.onboarding.application.MembershipStore;
import com.decoadmin.backend.modules.onboarding.application.SlugConflictException;
import com.decoadmin.backend.modules.onboarding.domain.OnboardingProfile;
import com.decoadmin.backend.modules.onboarding.domain.ProfileAnswers;
import com.decoadmin.backend.modules.onboarding.domain.ProfileState;
import com.decoadmin.backend.modules.organization.domain.DomainPolicy;
import com.decoadmin.backend.modules.organization.domain.EmailDomains;
import com.decoadmin.backend.modules.organization.domain.MemberSummary;
import com.decoadmin.backend.modules.organization.domain.Membership;
import com.decoadmin.backend.modules.organization.domain.MembershipRecord;
import com.decoadmin.backend.modules.organization.domain.MembershipRole;
import com.decoadmin.backend.modules.organization.domain.Organization;
import com.decoadmin.backend.modules.organization.domain.OrganizationDomainPolicy;
import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.MembershipRepository;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.OrganizationDomainPolicyRepository;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.OrganizationRepository;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link MembershipStore} on top of the JPA repositories. Each call commits on its own
 * so a unique-constraint failure never poisons a caller's surrounding work.
 */
@Component
public class JpaMembershipStore implements MembershipStore {

    static final String SLUG_CONSTRAINT = "uq_organization_slug";
    static final String CREATION_KEY_CONSTRAINT = "uq_organization_creator_creation_key";
    static final String MEMBERSHIP_CONSTRAINT = "uq_membership_user_org";

    private final OnboardingProfileRepository profileRepository;
    private final OrganizationRepository organizationRepository;
    private final OrganizationDomainPolicyRepository domainPolicyRepository;
    private final MembershipRepository membershipRepository;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final Clock clock;

    public JpaMembershipStore(
            OnboardingProfileRepository profileRepository,
            OrganizationRepository organizationRepository,
            OrganizationDomainPolicyRepository domainPolicyRepository,
            MembershipRepository membershipRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.profileRepository = profileRepository;
        this.organizationRepository = organizationRepository;
        this.domainPolicyRepository = domainPolicyRepository;
        this.membershipRepository = membershipRepository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.clock = clock;
    }

    @Override
    public Optional<ProfileState> findProfile(UUID userId) {
        return read(status -> profileRepository.findById(userId).map(OnboardingProfile::toState));
    }

    @Override
    public ProfileState upsertProfile(UUID userId, ProfileAnswers answers) {
        return write(status -> {
            profileRepository.upsertAnswers(
                    userId,
                    answers.role().name(),
                    answers.companySize().name(),
                    answers.useCase().name(),
                    OffsetDateTime.now(clock)
            );
            return profileRepository.findById(userId)
                    .map(OnboardingProfile::toState)
                    .orElseThrow(() -> new IllegalStateException("Profile missing right after upsert: " + userId));
        });
    }

    @Override
    public boolean markOnboardingCompleted(UUID userId, UUID destinationOrganizationId, OffsetDateTime completedAt) {
        return write(status -> {
            if (profileRepository.markCompleted(userId, destinationOrganizationId, completedAt) > 0) {
                return true;
            }
            if (destinationOrganizationId != null) {
                profileRepository.fillMissingDestination(userId, destinationOrganizationId, completedAt);
            }
            return false;
        });
    }

    @Override
    public List<DomainPolicy> listDomainPolicies(String emailDomain) {
        String policyDomain;
        try {
            policyDomain = EmailDomains.normalizePolicyDomain(emailDomain);
        } catch (IllegalArgumentException ex) {
            return List.of();
        }
        return read(status -> domainPolicyRepository.findByDomainEntry(policyDomain).stream()
                .map(OrganizationDomainPolicy::toPolicy)
                .toList());
    }

    @Override
    public Optional<DomainPolicy> findDomainPolicy(UUID organizationId) {
        return read(status -> domainPolicyRepository.findById(organizationId).map(OrganizationDomainPolicy::toPolicy));
    }

    @Override
    public Optional<OrganizationSummary> findOrganization(UUID organizationId) {
        return read(status -> organizationRepository.findById(organizationId).map(Organization::toSummary));
    }

    @Override
    public List<OrganizationSummary> findOrganizations(Collection<UUID> organizationIds) {
        if (organizationIds.isEmpty()) {
            return List.of();
        }
        return read(status -> organizationRepository.findAllById(organizationIds).stream()
                .map(Organization::toSummary)
                .toList());
    }

    @Override
    public Optional<OrganizationSummary> findOrganizationByCreationKey(UUID creatorUserId, String creationKey) {
        return read(status -> organizationRepository.findByCreatedByAndCreationKey(creatorUserId, creationKey)
                .map(Organization::toSummary));
    }

    @Override
    public MembershipRecord insertMembership(UUID userId, UUID organizationId, MembershipRole role) {
        try {
            return write(status -> {
                Membership membership = newMembership(userId, organizationRepository.getReferenceById(organizationId), role);
                membershipRepository.saveAndFlush(membership);
                return new MembershipRecord(userId, organizationId, role, membership.getJoinedAt());
            });
        } catch (DataIntegrityViolationException ex) {
            if (violates(ex, MEMBERSHIP_CONSTRAINT)) {
                throw new MembershipConflictException(userId, organizationId, ex);
            }
            throw ex;
        }
    }

    @Override
    public OrganizationSummary insertOrganization(String name, String slug, UUID creatorUserId, String creationKey) {
        try {
            return write(status -> {
                Organization organization = new Organization();
                organization.setName(name);
                organization.setSlug(slug);
                organization.setCreatedBy(creatorUserId);
                organization.setCreationKey(creationKey);
                organizationRepository.saveAndFlush(organization);

                membershipRepository.saveAndFlush(newMembership(creatorUserId, organization, MembershipRole.ADMIN));
                return organization.toSummary();
            });
        } catch (DataIntegrityViolationException ex) {
            if (violates(ex, SLUG_CONSTRAINT)) {
                throw new SlugConflictException(slug, ex);
            }
            if (violates(ex, CREATION_KEY_CONSTRAINT)) {
                throw new CreationKeyConflictException(creationKey, ex);
            }
            throw ex;
        }
    }

    @Override
    public boolean hasMembership(UUID userId, UUID organizationId) {
        return read(status -> membershipRepository.existsByUserAndOrganization(userId, organizationId));
    }

    @Override
    public Optional<MembershipRecord> findMembership(UUID userId, UUID organizationId) {
        return read(status -> membershipRepository.findByUserAndOrganization(userId, organizationId)
                .map(membership -> new MembershipRecord(
                        membership.getUserId(),
                        organizationId,
                        membership.getRole(),
                        membership.getJoinedAt())));
    }

    @Override
    public Map<UUID, MemberSummary> summarizeMembers(Collection<UUID> organizationIds, int sampleSize) {
        if (organizationIds.isEmpty()) {
            return Map.of();
        }
        return read(status -> {
            Map<UUID, Long> counts = new HashMap<>();
            for (Object[] row : membershipRepository.countByOrganizationIds(organizationIds)) {
                counts.put((UUID) row[0], ((Number) row[1]).longValue());
            }
            Map<UUID, MemberSummary> summaries = new LinkedHashMap<>();
            for (UUID organizationId : organizationIds) {
                long count = counts.getOrDefault(organizationId, 0L);
                List<UUID> sample = count == 0 || sampleSize <= 0
                        ? List.of()
                        : membershipRepository.findMemberIds(organizationId, PageRequest.of(0, sampleSize));
                summaries.put(organizationId, new MemberSummary(organizationId, count, sample));
            }
            return summaries;
        });
    }

    private Membership newMembership(UUID userId, Organization organization, MembershipRole role) {
        Membership membership = new Membership();
        membership.setUserId(userId);
        membership.setOrganization(organization);
        membership.setRole(role);
        membership.setJoinedAt(OffsetDateTime.now(clock));
        return membership;
    }

    private <T> T read(TransactionCallback<T> callback) {
        return execute(readTemplate, callback);
    }

    private <T> T write(TransactionCallback<T> callback) {
        return execute(writeTemplate, callback);
    }

    private static <T> T execute(TransactionTemplate template, TransactionCallback<T> callback) {
        try {
            return template.execute(callback);
        } catch (DataAccessResourceFailureException | TransientDataAccessException | CannotCreateTransactionException ex) {
            throw new RepositoryUnavailableException("Membership storage is temporarily unavailable", ex);
        }
    }

    static boolean violates(DataIntegrityViolationException ex, String constraintName) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(constraintName);
    }
}
