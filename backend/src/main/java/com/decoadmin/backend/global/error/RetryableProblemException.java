package com.decoadmin.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * A problem the client may retry after a back-off, rendered with a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter, Throwable cause) {
        super(status, code, detail, cause);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be zero or positive");
        }
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /** Whole seconds, rounded up, as the header expects. */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}
