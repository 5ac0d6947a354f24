package com.decoadmin.backend.modules.organization.application;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

import com.decoadmin.backend.global.config.OnboardingProperties;
import com.decoadmin.backend.global.security.AuthenticatedUser;
import com.decoadmin.backend.modules.onboarding.application.OnboardingError;
import com.decoadmin.backend.modules.onboarding.application.OnboardingException;
import com.decoadmin.backend.modules.organization.domain.CompanyNameSuggester;
import com.decoadmin.backend.modules.organization.domain.EmailDomains;
import com.decoadmin.backend.modules.organization.domain.MembershipRole;
import com.decoadmin.backend.modules.organization.domain.Organization;
import com.decoadmin.backend.modules.organization.domain.OrganizationDomainPolicy;
import com.decoadmin.backend.modules.organization.domain.SlugGenerator;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.MembershipRepository;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.OrganizationDomainPolicyRepository;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.OrganizationRepository;
import com.decoadmin.backend.modules.storage.application.BlobStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Second step after creating an organization: name, company URL, domain join
 * policy and logo. Only ADMIN members may change an organization.
 */
@Service
public class OrganizationSetupService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationSetupService.class);

    static final int MAX_NAME_LENGTH = 120;
    static final String AVATAR_PATH_PREFIX = "uploads/org-logo-";
    private static final String SLUG_CONSTRAINT = "uq_organization_slug";
    private static final Pattern SAFE_EXTENSION = Pattern.compile("[a-z0-9]{1,8}");

    private final OrganizationRepository organizationRepository;
    private final OrganizationDomainPolicyRepository domainPolicyRepository;
    private final MembershipRepository membershipRepository;
    private final BlobStorage blobStorage;
    private final OnboardingProperties properties;

    public OrganizationSetupService(
            OrganizationRepository organizationRepository,
            OrganizationDomainPolicyRepository domainPolicyRepository,
            MembershipRepository membershipRepository,
            BlobStorage blobStorage,
            OnboardingProperties properties
    ) {
        this.organizationRepository = organizationRepository;
        this.domainPolicyRepository = domainPolicyRepository;
        this.membershipRepository = membershipRepository;
        this.blobStorage = blobStorage;
        this.properties = properties;
    }

    public SetupSuggestion getSetupSuggestion(AuthenticatedUser user) {
        String domain = EmailDomains.extract(user.email());
        String name = CompanyNameSuggester.suggestName(domain);
        return new SetupSuggestion(domain, name, SlugGenerator.slugify(name), CompanyNameSuggester.logoUrl(domain));
    }

    @Transactional(readOnly = true)
    public OrganizationSettings getSettings(AuthenticatedUser user, UUID organizationId) {
        Organization organization = loadForAdmin(user, organizationId);
        return toSettings(organization, domainPolicyRepository.findById(organizationId).orElse(null));
    }

    /**
     * Renames the organization (its slug follows the name) and replaces its domain policy
     * with the single host of {@code companyUrl}.
     */
    @Transactional
    public OrganizationSettings updateOrganization(
            AuthenticatedUser user,
            UUID organizationId,
            String name,
            String companyUrl,
            boolean allowDomainJoin
    ) {
        Organization organization = loadForAdmin(user, organizationId);

        String trimmedName = name == null ? "" : name.trim();
        if (trimmedName.isEmpty() || trimmedName.length() > MAX_NAME_LENGTH) {
            throw validation("Organization name must be 1-" + MAX_NAME_LENGTH + " characters");
        }
        String slug = SlugGenerator.slugify(trimmedName);
        if (slug.isEmpty()) {
            throw validation("Organization name must contain at least one letter or digit");
        }
        if (!slug.equals(organization.getSlug()) && organizationRepository.existsBySlugAndIdNot(slug, organizationId)) {
            throw slugTaken(slug);
        }

        String host = CompanyNameSuggester.normalizeCompanyHost(companyUrl);
        if (allowDomainJoin && host.isEmpty()) {
            throw validation("A company URL is required to let teammates join by email domain");
        }
        OrganizationDomainPolicy policy = domainPolicyRepository.findById(organizationId)
                .orElseGet(() -> new OrganizationDomainPolicy(organizationId));
        try {
            policy.replaceDomains(host.isEmpty() ? List.of() : List.of(host));
        } catch (IllegalArgumentException ex) {
            throw validation("Invalid company URL: " + companyUrl);
        }
        policy.setOpen(allowDomainJoin);

        organization.setName(trimmedName);
        organization.setSlug(slug);
        try {
            organizationRepository.saveAndFlush(organization);
        } catch (DataIntegrityViolationException ex) {
            if (isSlugViolation(ex)) {
                throw slugTaken(slug);
            }
            throw ex;
        }
        domainPolicyRepository.save(policy);

        log.info("Organization updated org={} slug={} allowDomainJoin={} domains={}",
                organizationId, slug, allowDomainJoin, policy.getDomains());
        return toSettings(organization, policy);
    }

    @Transactional
    public OrganizationSettings uploadAvatar(
            AuthenticatedUser user,
            UUID organizationId,
            String originalFilename,
            String contentType,
            byte[] content
    ) {
        Organization organization = loadForAdmin(user, organizationId);
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw validation("Logo must be an image");
        }
        if (content == null || content.length == 0) {
            throw validation("Logo file is empty");
        }
        if (content.length > properties.avatar().maxBytes()) {
            throw validation("Logo must be at most " + properties.avatar().maxBytes() + " bytes");
        }

        String path = AVATAR_PATH_PREFIX + UUID.randomUUID() + "." + extensionOf(originalFilename, contentType);
        String url = blobStorage.write(path, contentType, content);
        organization.setAvatarUrl(url);
        organizationRepository.save(organization);

        log.info("Organization avatar stored org={} path={} bytes={}", organizationId, path, content.length);
        return toSettings(organization, domainPolicyRepository.findById(organizationId).orElse(null));
    }

    private Organization loadForAdmin(AuthenticatedUser user, UUID organizationId) {
        Organization organization = organizationRepository.findById(organizationId)
                .orElseThrow(() -> new OnboardingException(OnboardingError.ORGANIZATION_NOT_FOUND,
                        "Organization not found: " + organizationId));
        if (!membershipRepository.existsWithRole(user.userId(), organizationId, MembershipRole.ADMIN)) {
            throw new OnboardingException(OnboardingError.ORGANIZATION_ACCESS_DENIED,
                    "Only organization admins can change its settings");
        }
        return organization;
    }

    private static OrganizationSettings toSettings(Organization organization, OrganizationDomainPolicy policy) {
        if (policy == null) {
            return new OrganizationSettings(organization.toSummary(), false, List.of());
        }
        return new OrganizationSettings(organization.toSummary(), policy.isOpen(), policy.getDomains());
    }

    static String extensionOf(String originalFilename, String contentType) {
        if (originalFilename != null) {
            int dot = originalFilename.lastIndexOf('.');
            if (dot >= 0 && dot < originalFilename.length() - 1) {
                String extension = originalFilename.substring(dot + 1).toLowerCase(Locale.ROOT);
                if (SAFE_EXTENSION.matcher(extension).matches()) {
                    return extension;
                }
            }
        }
        // image/svg+xml -> svg
        String subtype = contentType.substring(contentType.indexOf('/') + 1).toLowerCase(Locale.ROOT);
        int plus = subtype.indexOf('+');
        if (plus >= 0) {
            subtype = subtype.substring(0, plus);
        }
        if ("jpeg".equals(subtype)) {
            return "jpg";
        }
        return SAFE_EXTENSION.matcher(subtype).matches() ? subtype : "img";
    }

    private static boolean isSlugViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(SLUG_CONSTRAINT);
    }

    private static OnboardingException validation(String detail) {
        return new OnboardingException(OnboardingError.VALIDATION_ERROR, detail);
    }

    private static OnboardingException slugTaken(String slug) {
        return new OnboardingException(OnboardingError.SLUG_TAKEN, "The URL \"" + slug + "\" is already taken");
    }
}
