package com.decoadmin.backend.modules.onboarding.application;

/**
 * Raised by {@link MembershipStore#insertOrganization} when the slug is already taken.
 */
public class SlugConflictException extends RuntimeException {

    private final String slug;

    public SlugConflictException(String slug, Throwable cause) {
        super("Organization slug already in use: " + slug, cause);
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
