package com.decoadmin.backend.modules.onboarding.application;

import java.util.UUID;

public class MembershipConflictException extends RuntimeException {

    public MembershipConflictException(UUID userId, UUID organizationId, Throwable cause) {
        super("Membership already exists for user " + userId + " in organization " + organizationId, cause);
    }
}
