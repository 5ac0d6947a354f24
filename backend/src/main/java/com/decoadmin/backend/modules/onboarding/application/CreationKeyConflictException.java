package com.decoadmin.backend.modules.onboarding.application;

/**
 * Another request from the same user already created an organization with this idempotency key.
 */
public class CreationKeyConflictException extends RuntimeException {

    public CreationKeyConflictException(String creationKey, Throwable cause) {
        super("Organization already created for key " + creationKey, cause);
    }
}
