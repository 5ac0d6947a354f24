package com.decoadmin.backend.modules.onboarding.domain;

import java.util.Objects;

public record ProfileAnswers(ProfileRole role, CompanySize companySize, UseCase useCase) {

    public ProfileAnswers {
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(companySize, "companySize is required");
        Objects.requireNonNull(useCase, "useCase is required");
    }
}
