package com.decoadmin.backend.modules.organization.application;

/**
 * Pre-filled values for the "set up your admin" form. All fields are empty strings
 * when the caller's email has no usable domain.
 */
public record SetupSuggestion(String companyUrl, String name, String slug, String logoUrl) {
}
