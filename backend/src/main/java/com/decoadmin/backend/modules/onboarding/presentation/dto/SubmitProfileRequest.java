package com.decoadmin.backend.modules.onboarding.presentation.dto;

/**
 * Wire values are checked against their closed vocabularies by the resolver so that
 * every invalid answer maps to {@code onboarding.validation_error}.
 */
public record SubmitProfileRequest(String role, String companySize, String useCase) {
}
