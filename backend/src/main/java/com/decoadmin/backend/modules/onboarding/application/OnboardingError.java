package com.decoadmin.backend.modules.onboarding.application;

import org.springframework.http.HttpStatus;

/**
 * Error kinds surfaced by onboarding and organization setup. Callers branch on the
 * kind (or its stable {@link #code()}), never on the message.
 */
public enum OnboardingError {
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY, "onboarding.validation_error"),
    PROFILE_REQUIRED(HttpStatus.CONFLICT, "onboarding.profile_required"),
    DOMAIN_NOT_ALLOWED(HttpStatus.FORBIDDEN, "onboarding.domain_not_allowed"),
    ORGANIZATION_NOT_FOUND(HttpStatus.NOT_FOUND, "organization.not_found"),
    SLUG_EXHAUSTED(HttpStatus.CONFLICT, "organization.slug_exhausted"),
    SLUG_TAKEN(HttpStatus.CONFLICT, "organization.slug_taken"),
    ORGANIZATION_ACCESS_DENIED(HttpStatus.FORBIDDEN, "organization.access_denied");

    private final HttpStatus status;
    private final String code;

    OnboardingError(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
