package com.decoadmin.backend.modules.onboarding.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProfileRole {
    ENGINEERING("engineering"),
    PRODUCT("product"),
    MARKETING("marketing"),
    DESIGN("design"),
    OPERATIONS("operations"),
    SALES("sales"),
    FOUNDER("founder"),
    OTHER("other");

    private final String wireValue;

    ProfileRole(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<ProfileRole> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values()).filter(role -> role.wireValue.equals(trimmed)).findFirst();
    }
}
