package com.decoadmin.backend.modules.onboarding.application;

import com.decoadmin.backend.global.error.ProblemException;

public class OnboardingException extends ProblemException {

    private final OnboardingError kind;

    public OnboardingException(OnboardingError kind, String detail) {
        super(kind.status(), kind.code(), detail);
        this.kind = kind;
    }

    public OnboardingError getKind() {
        return kind;
    }
}
