package com.decoadmin.backend.modules.analytics.application;

/**
 * Fire-and-forget event sink. Implementations must not throw: a lost event is
 * acceptable, a failed onboarding request because of one is not.
 */
public interface AnalyticsSink {

    void emit(AnalyticsEvent event);
}
