package com.decoadmin.backend.modules.onboarding.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UseCase {
    INTERNAL_APPS("internal-apps"),
    MANAGE_MCPS("manage-mcps"),
    AI_SAAS("ai-saas");

    private final String wireValue;

    UseCase(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<UseCase> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values()).filter(useCase -> useCase.wireValue.equals(trimmed)).findFirst();
    }
}
