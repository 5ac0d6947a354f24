package com.decoadmin.backend.global.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity handed over by the identity provider for the current request.
 * This backend never issues sessions; it only reads the verified claims.
 */
public record AuthenticatedUser(UUID userId, String email) {

    public AuthenticatedUser {
        Objects.requireNonNull(userId, "userId is required");
        email = email == null ? "" : email.trim();
    }
}
