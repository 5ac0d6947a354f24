package com.decoadmin.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required setting is missing or still holds a development placeholder.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-only-jwt-secret-change-me-in-production-0000";
    private static final int MIN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "app.cors.allowed-origins",
            "storage.public-base-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                missing.add(key);
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (jwtSecret.filter(secret -> secret.length() < MIN_SECRET_BYTES).isPresent()) {
            invalid.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " characters for HS256");
        }
        boolean production = environment.acceptsProfiles(org.springframework.core.env.Profiles.of("prod"));
        if (production && jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            invalid.add("jwt.secret: replace the development default");
        }

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            if (!missing.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missing));
            }
            invalid.forEach(problem -> log.error("Invalid setting - {}", problem));
            throw new IllegalStateException("Environment validation failed (missing=" + missing + ", invalid=" + invalid + ")");
        }

        log.info("Environment validation passed");
    }
}
