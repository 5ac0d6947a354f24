package com.decoadmin.backend.modules.onboarding.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Company size buckets offered by the profile form. {@code SOLO} is "Just me".
 */
public enum CompanySize {
    SOLO("1"),
    FROM_2_TO_25("2-25"),
    FROM_26_TO_100("26-100"),
    FROM_101_TO_500("101-500"),
    FROM_501_TO_1000("501-1000"),
    OVER_1000("1001+");

    private final String wireValue;

    CompanySize(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<CompanySize> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values()).filter(size -> size.wireValue.equals(trimmed)).findFirst();
    }
}
