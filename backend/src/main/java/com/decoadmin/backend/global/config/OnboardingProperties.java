package com.decoadmin.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables of the onboarding flow, bound from {@code onboarding.*}.
 *
 * @param slug   slug collision policy
 * @param avatar avatar upload limits
 */
@ConfigurationProperties(prefix = "onboarding")
public record OnboardingProperties(
        @DefaultValue Slug slug,
        @DefaultValue Avatar avatar
) {

    public static OnboardingProperties defaults() {
        return new OnboardingProperties(new Slug(5), new Avatar(5L * 1024 * 1024));
    }

    /**
     * @param maxRetries suffixed attempts allowed after the first slug collides
     */
    public record Slug(@DefaultValue("5") int maxRetries) {

        // keeps "-<attempt>" within the slug column next to a full-length base
        static final int MAX_RETRIES_LIMIT = 1000;

        public Slug {
            if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
                throw new IllegalArgumentException("onboarding.slug.max-retries must be 0-" + MAX_RETRIES_LIMIT);
            }
        }
    }

    public record Avatar(@DefaultValue("5242880") long maxBytes) {

        public Avatar {
            if (maxBytes <= 0) {
                throw new IllegalArgumentException("onboarding.avatar.max-bytes must be > 0");
            }
        }
    }
}
