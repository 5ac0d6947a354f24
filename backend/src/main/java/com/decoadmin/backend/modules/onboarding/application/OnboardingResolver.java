package com.decoadmin.backend.modules.onboarding.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.decoadmin.backend.global.config.OnboardingProperties;
import com.decoadmin.backend.global.error.RepositoryUnavailableException;
import com.decoadmin.backend.global.security.AuthenticatedUser;
import com.decoadmin.backend.modules.analytics.application.AnalyticsEvent;
import com.decoadmin.backend.modules.analytics.application.AnalyticsSink;
import com.decoadmin.backend.modules.onboarding.domain.CompanySize;
import com.decoadmin.backend.modules.onboarding.domain.OnboardingStage;
import com.decoadmin.backend.modules.onboarding.domain.OnboardingStateMachine;
import com.decoadmin.backend.modules.onboarding.domain.ProfileAnswers;
import com.decoadmin.backend.modules.onboarding.domain.ProfileRole;
import com.decoadmin.backend.modules.onboarding.domain.ProfileState;
import com.decoadmin.backend.modules.onboarding.domain.UseCase;
import com.decoadmin.backend.modules.organization.domain.DomainMatcher;
import com.decoadmin.backend.modules.organization.domain.DomainPolicy;
import com.decoadmin.backend.modules.organization.domain.EmailDomains;
import com.decoadmin.backend.modules.organization.domain.MemberSummary;
import com.decoadmin.backend.modules.organization.domain.MembershipRecord;
import com.decoadmin.backend.modules.organization.domain.MembershipRole;
import com.decoadmin.backend.modules.organization.domain.OrganizationNameSupplier;
import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;
import com.decoadmin.backend.modules.organization.domain.SlugGenerator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a user from sign-up to their first organization.
 *
 * <p>Holds no state between calls: every decision is re-derived from the
 * {@link MembershipStore}, so any number of instances may serve the same user.
 * Each store call is its own transaction; uniqueness races are settled by the
 * store's constraints and mapped back to idempotent outcomes here.</p>
 */
@Service
public class OnboardingResolver {

    private static final Logger log = LoggerFactory.getLogger(OnboardingResolver.class);

    static final int SAMPLE_MEMBER_COUNT = 4;
    static final int MAX_ORGANIZATION_NAME_LENGTH = 120;
    static final int MAX_CREATION_KEY_LENGTH = 128;

    private final MembershipStore membershipStore;
    private final OrganizationNameSupplier organizationNameSupplier;
    private final AnalyticsSink analyticsSink;
    private final OnboardingProperties properties;
    private final Clock clock;

    public OnboardingResolver(
            MembershipStore membershipStore,
            OrganizationNameSupplier organizationNameSupplier,
            AnalyticsSink analyticsSink,
            OnboardingProperties properties,
            Clock clock
    ) {
        this.membershipStore = membershipStore;
        this.organizationNameSupplier = organizationNameSupplier;
        this.analyticsSink = analyticsSink;
        this.properties = properties;
        this.clock = clock;
    }

    public OnboardingState getState(AuthenticatedUser user) {
        Optional<ProfileState> profile = membershipStore.findProfile(user.userId());
        OnboardingStage stage = OnboardingStateMachine.stageOf(profile);
        return switch (stage) {
            case NOT_STARTED -> OnboardingState.notStarted();
            case COMPLETED -> new OnboardingState(stage, profile.get(), List.of(), loadDestination(profile.get()));
            default -> new OnboardingState(stage, profile.get(), listJoinableOrganizations(user), null);
        };
    }

    /**
     * Organizations whose open domain policy admits the user's email domain,
     * in policy order, with a member preview for each.
     */
    public List<JoinableOrganization> listJoinableOrganizations(AuthenticatedUser user) {
        List<UUID> joinableIds = findJoinableIds(user);
        if (joinableIds.isEmpty()) {
            return List.of();
        }
        Map<UUID, OrganizationSummary> organizations = membershipStore.findOrganizations(joinableIds).stream()
                .collect(Collectors.toMap(OrganizationSummary::id, Function.identity(), (left, right) -> left));
        Map<UUID, MemberSummary> members = membershipStore.summarizeMembers(joinableIds, SAMPLE_MEMBER_COUNT);

        List<JoinableOrganization> result = new ArrayList<>(joinableIds.size());
        for (UUID organizationId : joinableIds) {
            OrganizationSummary organization = organizations.get(organizationId);
            if (organization == null) {
                continue;
            }
            MemberSummary summary = members.getOrDefault(organizationId, MemberSummary.empty(organizationId));
            result.add(new JoinableOrganization(organization, summary.memberCount(), summary.sampleMemberIds()));
        }
        return result;
    }

    /**
     * Stores the profile answers and advances onboarding. The skip-to-completed
     * decision is taken here, against the policies that exist right now; answers
     * submitted again after completion are overwritten without reopening onboarding.
     *
     * @throws OnboardingException VALIDATION_ERROR when a value is outside its closed set
     */
    public ProfileState submitProfile(AuthenticatedUser user, String role, String companySize, String useCase) {
        ProfileAnswers answers = parseAnswers(role, companySize, useCase);
        UUID userId = user.userId();

        OnboardingStage current = OnboardingStateMachine.stageOf(membershipStore.findProfile(userId));
        ProfileState saved = membershipStore.upsertProfile(userId, answers);
        if (current == OnboardingStage.COMPLETED) {
            return saved;
        }

        OnboardingStage collected = current == OnboardingStage.NOT_STARTED
                ? OnboardingStateMachine.transition(current, OnboardingStage.PROFILE_COLLECTED)
                : current;
        OnboardingStage next = OnboardingStateMachine.transition(
                collected, OnboardingStateMachine.afterProfileCollected(findJoinableIds(user).size()));
        if (next != OnboardingStage.COMPLETED) {
            return saved;
        }

        if (markCompleted(user, null)) {
            log.info("Onboarding completed without organization choice user={}", userId);
            emitCompleted(user, "skip", null);
        }
        return membershipStore.findProfile(userId).orElse(saved);
    }

    /**
     * Joins an organization offered through its domain policy. A repeated join of the
     * same organization succeeds with {@code alreadyMember = true}. Once onboarding is
     * completed, joining another organization adds the membership but the recorded
     * destination stays the first one.
     *
     * @throws OnboardingException PROFILE_REQUIRED, ORGANIZATION_NOT_FOUND or DOMAIN_NOT_ALLOWED
     */
    public OrganizationDestination joinOrganization(AuthenticatedUser user, UUID organizationId) {
        UUID userId = user.userId();
        requireOrganizationChoice(userId);
        OrganizationSummary organization = membershipStore.findOrganization(organizationId)
                .orElseThrow(() -> new OnboardingException(OnboardingError.ORGANIZATION_NOT_FOUND,
                        "Organization not found: " + organizationId));

        if (membershipStore.findMembership(userId, organizationId).isPresent()) {
            log.debug("Join replayed for existing membership user={} org={}", userId, organizationId);
            completeWith(user, organization, "join");
            return OrganizationDestination.of(organization, true);
        }

        String emailDomain = EmailDomains.extract(user.email());
        boolean admitted = membershipStore.findDomainPolicy(organizationId)
                .map(policy -> DomainMatcher.admits(policy, emailDomain))
                .orElse(false);
        if (!admitted) {
            log.info("Join rejected by domain policy user={} org={} domain={}", userId, organizationId, emailDomain);
            throw new OnboardingException(OnboardingError.DOMAIN_NOT_ALLOWED,
                    "Your email domain is not allowed to join this organization");
        }

        boolean alreadyMember;
        try {
            MembershipRecord membership = membershipStore.insertMembership(userId, organizationId, MembershipRole.MEMBER);
            log.info("User joined organization user={} org={} role={}", userId, organizationId, membership.role());
            alreadyMember = false;
        } catch (MembershipConflictException ex) {
            log.debug("Concurrent join settled by membership constraint user={} org={}", userId, organizationId);
            alreadyMember = true;
        }
        if (!alreadyMember) {
            emit(new AnalyticsEvent(AnalyticsEvent.ORGANIZATION_JOINED, userId,
                    Map.of("organizationId", organizationId), OffsetDateTime.now(clock)));
        }
        completeWith(user, organization, "join");
        return OrganizationDestination.of(organization, alreadyMember);
    }

    /**
     * Creates an organization owned by the user. A blank name falls back to the
     * injected name supplier; slug collisions are retried with numeric suffixes.
     * With an idempotency key, a repeated call returns the organization created first.
     *
     * @throws OnboardingException PROFILE_REQUIRED, VALIDATION_ERROR or SLUG_EXHAUSTED
     */
    public OrganizationDestination createOrganization(AuthenticatedUser user, String requestedName, String idempotencyKey) {
        UUID userId = user.userId();
        requireOrganizationChoice(userId);
        String creationKey = normalizeCreationKey(idempotencyKey);

        if (creationKey != null) {
            Optional<OrganizationSummary> existing = membershipStore.findOrganizationByCreationKey(userId, creationKey);
            if (existing.isPresent()) {
                log.debug("Create replayed for key user={} org={}", userId, existing.get().id());
                completeWith(user, existing.get(), "create");
                return OrganizationDestination.of(existing.get(), true);
            }
        }

        String name = resolveName(requestedName);
        String baseSlug = SlugGenerator.slugify(name);
        if (baseSlug.isEmpty()) {
            throw new OnboardingException(OnboardingError.VALIDATION_ERROR,
                    "Organization name must contain at least one letter or digit");
        }

        int maxAttempts = 1 + properties.slug().maxRetries();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String slug = SlugGenerator.withSuffix(baseSlug, attempt);
            try {
                OrganizationSummary created = membershipStore.insertOrganization(name, slug, userId, creationKey);
                log.info("Organization created user={} org={} slug={} attempt={}", userId, created.id(), slug, attempt);
                emit(new AnalyticsEvent(AnalyticsEvent.ORGANIZATION_CREATED, userId,
                        Map.of("organizationId", created.id(), "slug", slug), OffsetDateTime.now(clock)));
                completeWith(user, created, "create");
                return OrganizationDestination.of(created, false);
            } catch (SlugConflictException ex) {
                log.debug("Slug taken slug={} attempt={}/{}", slug, attempt, maxAttempts);
            } catch (CreationKeyConflictException ex) {
                OrganizationSummary existing = membershipStore.findOrganizationByCreationKey(userId, creationKey)
                        .orElseThrow(() -> new RepositoryUnavailableException(
                                "Organization for idempotency key is not readable yet", ex));
                completeWith(user, existing, "create");
                return OrganizationDestination.of(existing, true);
            }
        }

        log.warn("Slug candidates exhausted user={} base={} attempts={}", userId, baseSlug, maxAttempts);
        throw new OnboardingException(OnboardingError.SLUG_EXHAUSTED,
                "Could not find a free URL for \"" + name + "\"; try a different name");
    }

    private List<UUID> findJoinableIds(AuthenticatedUser user) {
        String emailDomain = EmailDomains.extract(user.email());
        if (emailDomain.isEmpty()) {
            return List.of();
        }
        List<DomainPolicy> policies = membershipStore.listDomainPolicies(emailDomain);
        return DomainMatcher.findJoinable(emailDomain, policies);
    }

    private void requireOrganizationChoice(UUID userId) {
        OnboardingStage stage = OnboardingStateMachine.stageOf(membershipStore.findProfile(userId));
        if (!OnboardingStateMachine.allowsOrganizationChoice(stage)) {
            throw new OnboardingException(OnboardingError.PROFILE_REQUIRED,
                    "Complete your profile before choosing an organization");
        }
    }

    private OrganizationSummary loadDestination(ProfileState profile) {
        if (profile.destinationOrganizationId() == null) {
            return null;
        }
        return membershipStore.findOrganization(profile.destinationOrganizationId()).orElse(null);
    }

    private void completeWith(AuthenticatedUser user, OrganizationSummary organization, String path) {
        if (markCompleted(user, organization.id())) {
            log.info("Onboarding completed user={} org={} path={}", user.userId(), organization.id(), path);
            emitCompleted(user, path, organization.id());
        }
    }

    private boolean markCompleted(AuthenticatedUser user, UUID destinationOrganizationId) {
        return membershipStore.markOnboardingCompleted(user.userId(), destinationOrganizationId, OffsetDateTime.now(clock));
    }

    private void emitCompleted(AuthenticatedUser user, String path, UUID organizationId) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("path", path);
        properties.put("organizationId", organizationId);
        properties.put("emailDomain", EmailDomains.extract(user.email()));
        emit(new AnalyticsEvent(AnalyticsEvent.ONBOARDING_COMPLETED, user.userId(), properties, OffsetDateTime.now(clock)));
    }

    private void emit(AnalyticsEvent event) {
        try {
            analyticsSink.emit(event);
        } catch (RuntimeException ex) {
            log.warn("Analytics event dropped name={} user={}", event.name(), event.userId(), ex);
        }
    }

    private String resolveName(String requestedName) {
        String name = requestedName == null ? "" : requestedName.trim();
        if (name.isEmpty()) {
            name = Objects.requireNonNull(organizationNameSupplier.get(), "organization name supplier returned null").trim();
        }
        if (name.length() > MAX_ORGANIZATION_NAME_LENGTH) {
            throw new OnboardingException(OnboardingError.VALIDATION_ERROR,
                    "Organization name must be at most " + MAX_ORGANIZATION_NAME_LENGTH + " characters");
        }
        return name;
    }

    private static String normalizeCreationKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return null;
        }
        String key = idempotencyKey.trim();
        if (key.length() > MAX_CREATION_KEY_LENGTH) {
            throw new OnboardingException(OnboardingError.VALIDATION_ERROR,
                    "Idempotency-Key must be at most " + MAX_CREATION_KEY_LENGTH + " characters");
        }
        return key;
    }

    private static ProfileAnswers parseAnswers(String role, String companySize, String useCase) {
        Optional<ProfileRole> parsedRole = ProfileRole.fromWire(role);
        Optional<CompanySize> parsedSize = CompanySize.fromWire(companySize);
        Optional<UseCase> parsedUseCase = UseCase.fromWire(useCase);

        List<String> invalid = new ArrayList<>();
        if (parsedRole.isEmpty()) {
            invalid.add("role");
        }
        if (parsedSize.isEmpty()) {
            invalid.add("companySize");
        }
        if (parsedUseCase.isEmpty()) {
            invalid.add("useCase");
        }
        if (!invalid.isEmpty()) {
            throw new OnboardingException(OnboardingError.VALIDATION_ERROR,
                    "Invalid value for " + String.join(", ", invalid));
        }
        return new ProfileAnswers(parsedRole.get(), parsedSize.get(), parsedUseCase.get());
    }
}
