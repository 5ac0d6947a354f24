package com.decoadmin.backend.modules.onboarding.presentation;

import java.util.List;

import com.decoadmin.backend.global.security.AuthenticatedUser;
import com.decoadmin.backend.global.security.SecurityUtils;
import com.decoadmin.backend.modules.onboarding.application.OnboardingResolver;
import com.decoadmin.backend.modules.onboarding.presentation.dto.JoinableOrganizationResponse;
import com.decoadmin.backend.modules.onboarding.presentation.dto.OnboardingDtoMapper;
import com.decoadmin.backend.modules.onboarding.presentation.dto.OnboardingStateResponse;
import com.decoadmin.backend.modules.onboarding.presentation.dto.SubmitProfileRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/onboarding")
public class OnboardingController {

    private final OnboardingResolver onboardingResolver;

    public OnboardingController(OnboardingResolver onboardingResolver) {
        this.onboardingResolver = onboardingResolver;
    }

    @Operation(summary = "Current onboarding stage, profile, joinable organizations and destination")
    @GetMapping("/state")
    public ResponseEntity<OnboardingStateResponse> getState() {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(OnboardingDtoMapper.toStateResponse(onboardingResolver.getState(user)));
    }

    @Operation(
            summary = "Submit the profile questionnaire",
            description = """
                    Stores role, company size and use case. When no organization admits the \
                    caller's email domain at this moment, onboarding completes immediately \
                    and the response stage is `COMPLETED` without a destination.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile stored, resulting onboarding state returned"),
            @ApiResponse(responseCode = "422", description = "A value is outside its vocabulary - `onboarding.validation_error`")
    })
    @PutMapping("/profile")
    public ResponseEntity<OnboardingStateResponse> submitProfile(@RequestBody SubmitProfileRequest request) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        onboardingResolver.submitProfile(user, request.role(), request.companySize(), request.useCase());
        return ResponseEntity.ok(OnboardingDtoMapper.toStateResponse(onboardingResolver.getState(user)));
    }

    @GetMapping("/joinable-organizations")
    public ResponseEntity<List<JoinableOrganizationResponse>> getJoinableOrganizations() {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(OnboardingDtoMapper.toJoinableResponses(onboardingResolver.listJoinableOrganizations(user)));
    }
}
