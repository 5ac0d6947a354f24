package com.decoadmin.backend.modules.analytics.infrastructure;

import java.util.Locale;

import com.decoadmin.backend.global.web.RequestIdFilter;
import com.decoadmin.backend.modules.analytics.application.AnalyticsEvent;
import com.decoadmin.backend.modules.analytics.application.AnalyticsSink;
import com.decoadmin.backend.modules.audit.application.AuditLogService;
import com.decoadmin.backend.modules.audit.application.AuditLogService.AuditLogCommand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Keeps analytics events in the audit log, where product dashboards read them.
 */
@Component
public class AuditLogAnalyticsSink implements AnalyticsSink {

    private static final Logger log = LoggerFactory.getLogger(AuditLogAnalyticsSink.class);

    static final String RESOURCE_TYPE = "ONBOARDING";

    private final AuditLogService auditLogService;

    public AuditLogAnalyticsSink(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Override
    public void emit(AnalyticsEvent event) {
        try {
            auditLogService.record(new AuditLogCommand(
                    event.name().toUpperCase(Locale.ROOT),
                    RESOURCE_TYPE,
                    event.userId() != null ? event.userId().toString() : "anonymous",
                    event.userId(),
                    MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY),
                    event.properties(),
                    event.occurredAt()
            ));
        } catch (RuntimeException ex) {
            log.warn("Failed to record analytics event name={} user={}: {}",
                    event.name(), event.userId(), ex.getMessage());
        }
    }
}
