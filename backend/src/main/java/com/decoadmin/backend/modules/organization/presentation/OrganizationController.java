package com.decoadmin.backend.modules.organization.presentation;

import java.io.IOException;
import java.util.UUID;

import com.decoadmin.backend.global.security.AuthenticatedUser;
import com.decoadmin.backend.global.security.SecurityUtils;
import com.decoadmin.backend.modules.onboarding.application.OnboardingResolver;
import com.decoadmin.backend.modules.onboarding.application.OrganizationDestination;
import com.decoadmin.backend.modules.organization.application.OrganizationSetupService;
import com.decoadmin.backend.modules.organization.presentation.dto.CreateOrganizationRequest;
import com.decoadmin.backend.modules.organization.presentation.dto.OrganizationDestinationResponse;
import com.decoadmin.backend.modules.organization.presentation.dto.OrganizationSettingsResponse;
import com.decoadmin.backend.modules.organization.presentation.dto.SetupSuggestionResponse;
import com.decoadmin.backend.modules.organization.presentation.dto.UpdateOrganizationRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/organizations")
public class OrganizationController {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final OnboardingResolver onboardingResolver;
    private final OrganizationSetupService organizationSetupService;

    public OrganizationController(OnboardingResolver onboardingResolver, OrganizationSetupService organizationSetupService) {
        this.onboardingResolver = onboardingResolver;
        this.organizationSetupService = organizationSetupService;
    }

    @Operation(
            summary = "Create an organization",
            description = """
                    Creates an organization with the caller as ADMIN and completes onboarding. \
                    A blank name gets a generated one. Slug collisions are retried with `-2`, `-3`, ... \
                    Repeating the call with the same `Idempotency-Key` returns the organization created first.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Organization created"),
            @ApiResponse(responseCode = "200", description = "Replay of an earlier call with the same Idempotency-Key"),
            @ApiResponse(responseCode = "409", description = "`onboarding.profile_required` or `organization.slug_exhausted`")
    })
    @PostMapping
    public ResponseEntity<OrganizationDestinationResponse> createOrganization(
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody(required = false) CreateOrganizationRequest request
    ) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        String name = request == null ? null : request.name();
        OrganizationDestination destination = onboardingResolver.createOrganization(user, name, idempotencyKey);
        HttpStatus status = destination.alreadyMember() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(OrganizationDestinationResponse.from(destination));
    }

    @Operation(summary = "Join an organization that admits the caller's email domain")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Joined, or already a member (`alreadyMember`)"),
            @ApiResponse(responseCode = "403", description = "`onboarding.domain_not_allowed`"),
            @ApiResponse(responseCode = "404", description = "`organization.not_found`")
    })
    @PostMapping("/{organizationId}/join")
    public ResponseEntity<OrganizationDestinationResponse> joinOrganization(@PathVariable("organizationId") UUID organizationId) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(OrganizationDestinationResponse.from(onboardingResolver.joinOrganization(user, organizationId)));
    }

    @GetMapping("/setup/suggestion")
    public ResponseEntity<SetupSuggestionResponse> getSetupSuggestion() {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(SetupSuggestionResponse.from(organizationSetupService.getSetupSuggestion(user)));
    }

    @GetMapping("/{organizationId}")
    public ResponseEntity<OrganizationSettingsResponse> getOrganization(@PathVariable("organizationId") UUID organizationId) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(OrganizationSettingsResponse.from(organizationSetupService.getSettings(user, organizationId)));
    }

    @Operation(summary = "Rename the organization and set its domain join policy (admins only)")
    @PatchMapping("/{organizationId}")
    public ResponseEntity<OrganizationSettingsResponse> updateOrganization(
            @PathVariable("organizationId") UUID organizationId,
            @Valid @RequestBody UpdateOrganizationRequest request
    ) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(OrganizationSettingsResponse.from(organizationSetupService.updateOrganization(
                user, organizationId, request.name(), request.companyUrl(), request.allowDomainJoin())));
    }

    @Operation(summary = "Upload the organization logo (admins only, image/*)")
    @PostMapping(path = "/{organizationId}/avatar", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<OrganizationSettingsResponse> uploadAvatar(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam("file") MultipartFile file
    ) throws IOException {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(OrganizationSettingsResponse.from(organizationSetupService.uploadAvatar(
                user, organizationId, file.getOriginalFilename(), file.getContentType(), file.getBytes())));
    }
}
