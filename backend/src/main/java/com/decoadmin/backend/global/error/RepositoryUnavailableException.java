package com.decoadmin.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * Storage could not be reached. Safe for the client to retry; nothing retries automatically.
 */
public class RepositoryUnavailableException extends RetryableProblemException {

    public static final String CODE = "repository.unavailable";
    private static final Duration RETRY_AFTER = Duration.ofSeconds(5);

    public RepositoryUnavailableException(String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, detail, RETRY_AFTER, cause);
    }
}
