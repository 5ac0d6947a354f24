package com.decoadmin.backend.modules.organization.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.decoadmin.backend.global.config.OnboardingProperties;
import com.decoadmin.backend.global.security.AuthenticatedUser;
import com.decoadmin.backend.modules.onboarding.application.OnboardingError;
import com.decoadmin.backend.modules.onboarding.application.OnboardingException;
import com.decoadmin.backend.modules.organization.domain.MembershipRole;
import com.decoadmin.backend.modules.organization.domain.Organization;
import com.decoadmin.backend.modules.organization.domain.OrganizationDomainPolicy;
import com.decoadmin.backend.modules.organization.domain.SlugGenerator;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.MembershipRepository;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.OrganizationDomainPolicyRepository;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.OrganizationRepository;
import com.decoadmin.backend.modules.storage.application.BlobStorage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class OrganizationSetupServiceTest {

    private static final UUID ORGANIZATION_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private OrganizationRepository organizationRepository;

    @Mock
    private OrganizationDomainPolicyRepository domainPolicyRepository;

    @Mock
    private MembershipRepository membershipRepository;

    @Mock
    private BlobStorage blobStorage;

    private OrganizationSetupService service;
    private AuthenticatedUser admin;
    private Organization organization;

    @BeforeEach
    void setUp() {
        service = new OrganizationSetupService(
                organizationRepository,
                domainPolicyRepository,
                membershipRepository,
                blobStorage,
                new OnboardingProperties(new OnboardingProperties.Slug(5), new OnboardingProperties.Avatar(1024))
        );
        admin = new AuthenticatedUser(UUID.fromString("00000000-0000-0000-0000-000000000001"), "jane@acme.com");

        organization = new Organization();
        organization.setName("Magic Unicorn");
        organization.setSlug("magic-unicorn");
        organization.setCreatedBy(admin.userId());
        // id is generated on persist
        try {
            java.lang.reflect.Field idField = Organization.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(organization, ORGANIZATION_ID);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }

    private void givenAdmin(boolean isAdmin) {
        when(organizationRepository.findById(ORGANIZATION_ID)).thenReturn(Optional.of(organization));
        when(membershipRepository.existsWithRole(admin.userId(), ORGANIZATION_ID, MembershipRole.ADMIN)).thenReturn(isAdmin);
    }

    @Test
    @DisplayName("suggestion is derived from the caller's email domain")
    void suggestion() {
        SetupSuggestion suggestion = service.getSetupSuggestion(admin);

        assertThat(suggestion.companyUrl()).isEqualTo("acme.com");
        assertThat(suggestion.name()).isEqualTo("Acme");
        assertThat(suggestion.slug()).isEqualTo("acme");
        assertThat(suggestion.logoUrl()).isEqualTo("https://www.google.com/s2/favicons?domain=acme.com&sz=256");
    }

    @Test
    @DisplayName("update renames, re-slugs and opens the company domain")
    void update() {
        givenAdmin(true);
        when(organizationRepository.existsBySlugAndIdNot("acme", ORGANIZATION_ID)).thenReturn(false);
        when(domainPolicyRepository.findById(ORGANIZATION_ID)).thenReturn(Optional.empty());

        OrganizationSettings settings = service.updateOrganization(admin, ORGANIZATION_ID, " Acme ", "https://www.acme.com", true);

        assertThat(settings.organization().name()).isEqualTo("Acme");
        assertThat(settings.organization().slug()).isEqualTo("acme");
        assertThat(settings.allowDomainJoin()).isTrue();
        assertThat(settings.allowedDomains()).containsExactly("@acme.com");

        ArgumentCaptor<OrganizationDomainPolicy> policyCaptor = ArgumentCaptor.forClass(OrganizationDomainPolicy.class);
        verify(domainPolicyRepository).save(policyCaptor.capture());
        assertThat(policyCaptor.getValue().getOrganizationId()).isEqualTo(ORGANIZATION_ID);
        assertThat(policyCaptor.getValue().isOpen()).isTrue();
        verify(organizationRepository).saveAndFlush(organization);
    }

    @Test
    void renameToNameThatGrowsWhenLowercasedKeepsSlugWithinColumn() {
        givenAdmin(true);
        when(organizationRepository.existsBySlugAndIdNot(anyString(), eq(ORGANIZATION_ID))).thenReturn(false);
        when(domainPolicyRepository.findById(ORGANIZATION_ID)).thenReturn(Optional.empty());
        String name = "İ".repeat(OrganizationSetupService.MAX_NAME_LENGTH);

        OrganizationSettings settings = service.updateOrganization(admin, ORGANIZATION_ID, name, "acme.com", false);

        assertThat(settings.organization().name()).isEqualTo(name);
        assertThat(settings.organization().slug()).hasSizeLessThanOrEqualTo(SlugGenerator.MAX_LENGTH)
                .matches("[a-z0-9]+(-[a-z0-9]+)*");
        verify(organizationRepository).saveAndFlush(organization);
    }

    @Test
    @DisplayName("a slug held by another organization is rejected")
    void slugTaken() {
        givenAdmin(true);
        when(organizationRepository.existsBySlugAndIdNot("acme", ORGANIZATION_ID)).thenReturn(true);

        assertThatThrownBy(() -> service.updateOrganization(admin, ORGANIZATION_ID, "Acme", "acme.com", false))
                .isInstanceOfSatisfying(OnboardingException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(OnboardingError.SLUG_TAKEN));
        verify(organizationRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("a slug claimed concurrently is reported the same way")
    void slugTakenOnFlush() {
        givenAdmin(true);
        when(organizationRepository.existsBySlugAndIdNot("acme", ORGANIZATION_ID)).thenReturn(false);
        when(domainPolicyRepository.findById(ORGANIZATION_ID)).thenReturn(Optional.empty());
        when(organizationRepository.saveAndFlush(organization)).thenThrow(new DataIntegrityViolationException("dup",
                new RuntimeException("duplicate key value violates unique constraint \"uq_organization_slug\"")));

        assertThatThrownBy(() -> service.updateOrganization(admin, ORGANIZATION_ID, "Acme", "", false))
                .isInstanceOfSatisfying(OnboardingException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(OnboardingError.SLUG_TAKEN));
    }

    @Test
    @DisplayName("domain join needs a company URL")
    void domainJoinWithoutUrl() {
        givenAdmin(true);

        assertThatThrownBy(() -> service.updateOrganization(admin, ORGANIZATION_ID, "Magic Unicorn", "  ", true))
                .isInstanceOfSatisfying(OnboardingException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(OnboardingError.VALIDATION_ERROR));
    }

    @Test
    @DisplayName("members without the ADMIN role cannot change settings")
    void accessDenied() {
        givenAdmin(false);

        assertThatThrownBy(() -> service.updateOrganization(admin, ORGANIZATION_ID, "Acme", "acme.com", true))
                .isInstanceOfSatisfying(OnboardingException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(OnboardingError.ORGANIZATION_ACCESS_DENIED));
    }

    @Test
    @DisplayName("avatar upload stores the blob and keeps its URL")
    void uploadAvatar() {
        givenAdmin(true);
        when(domainPolicyRepository.findById(ORGANIZATION_ID)).thenReturn(Optional.empty());
        when(blobStorage.write(anyString(), eq("image/png"), any(byte[].class)))
                .thenAnswer(inv -> "http://localhost:8080/files/" + inv.getArgument(0));

        OrganizationSettings settings = service.uploadAvatar(admin, ORGANIZATION_ID, "Logo.PNG", "image/png", new byte[]{1, 2, 3});

        ArgumentCaptor<String> pathCaptor = ArgumentCaptor.forClass(String.class);
        verify(blobStorage).write(pathCaptor.capture(), eq("image/png"), any(byte[].class));
        assertThat(pathCaptor.getValue()).matches("uploads/org-logo-[0-9a-f\\-]{36}\\.png");
        assertThat(settings.organization().avatarUrl()).isEqualTo("http://localhost:8080/files/" + pathCaptor.getValue());
        verify(organizationRepository).save(organization);
    }

    @Test
    @DisplayName("non-image and oversized uploads are rejected before storage")
    void uploadAvatarRejected() {
        givenAdmin(true);

        assertThatThrownBy(() -> service.uploadAvatar(admin, ORGANIZATION_ID, "notes.txt", "text/plain", new byte[]{1}))
                .isInstanceOfSatisfying(OnboardingException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(OnboardingError.VALIDATION_ERROR));
        assertThatThrownBy(() -> service.uploadAvatar(admin, ORGANIZATION_ID, "big.png", "image/png", new byte[2048]))
                .isInstanceOfSatisfying(OnboardingException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(OnboardingError.VALIDATION_ERROR));
        verify(blobStorage, never()).write(anyString(), anyString(), any(byte[].class));
    }

    @Test
    @DisplayName("extension falls back to the content type")
    void extensionOf() {
        assertThat(OrganizationSetupService.extensionOf("logo", "image/jpeg")).isEqualTo("jpg");
        assertThat(OrganizationSetupService.extensionOf(null, "image/svg+xml")).isEqualTo("svg");
        assertThat(OrganizationSetupService.extensionOf("x.webp", "image/png")).isEqualTo("webp");
        assertThat(OrganizationSetupService.extensionOf("x.p n g", "image/png")).isEqualTo("png");
    }

    @Test
    @DisplayName("unknown organizations are reported as not found")
    void notFound() {
        when(organizationRepository.findById(ORGANIZATION_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getSettings(admin, ORGANIZATION_ID))
                .isInstanceOfSatisfying(OnboardingException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(OnboardingError.ORGANIZATION_NOT_FOUND));
    }

    @Test
    @DisplayName("settings reflect the stored domain policy")
    void settings() {
        givenAdmin(true);
        OrganizationDomainPolicy policy = new OrganizationDomainPolicy(ORGANIZATION_ID);
        policy.replaceDomains(List.of("acme.com"));
        when(domainPolicyRepository.findById(ORGANIZATION_ID)).thenReturn(Optional.of(policy));

        OrganizationSettings settings = service.getSettings(admin, ORGANIZATION_ID);

        assertThat(settings.allowDomainJoin()).isFalse();
        assertThat(settings.allowedDomains()).containsExactly("@acme.com");
    }
}
