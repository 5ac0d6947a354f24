package com.decoadmin.backend.modules.organization.presentation.dto;

import com.decoadmin.backend.modules.organization.application.SetupSuggestion;

public record SetupSuggestionResponse(String companyUrl, String name, String slug, String logoUrl) {

    public static SetupSuggestionResponse from(SetupSuggestion suggestion) {
        return new SetupSuggestionResponse(suggestion.companyUrl(), suggestion.name(), suggestion.slug(), suggestion.logoUrl());
    }
}
