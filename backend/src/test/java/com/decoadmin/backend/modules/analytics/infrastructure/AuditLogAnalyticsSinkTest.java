package com.decoadmin.backend.modules.analytics.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.decoadmin.backend.global.web.RequestIdFilter;
import com.decoadmin.backend.modules.analytics.application.AnalyticsEvent;
import com.decoadmin.backend.modules.audit.application.AuditLogService;
import com.decoadmin.backend.modules.audit.application.AuditLogService.AuditLogCommand;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class AuditLogAnalyticsSinkTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final OffsetDateTime OCCURRED_AT = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private AuditLogService auditLogService;

    private AuditLogAnalyticsSink sink;

    @BeforeEach
    void setUp() {
        sink = new AuditLogAnalyticsSink(auditLogService);
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void recordsEventAsOnboardingAuditEntryWithRequestId() {
        MDC.put(RequestIdFilter.REQUEST_ID_MDC_KEY, "req-42");
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("path", "skip");
        properties.put("organizationId", null);

        sink.emit(new AnalyticsEvent(AnalyticsEvent.ONBOARDING_COMPLETED, USER_ID, properties, OCCURRED_AT));

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        AuditLogCommand command = captor.getValue();
        assertThat(command.actionType()).isEqualTo("ONBOARDING_COMPLETED");
        assertThat(command.resourceType()).isEqualTo("ONBOARDING");
        assertThat(command.resourceKey()).isEqualTo(USER_ID.toString());
        assertThat(command.actorUserId()).isEqualTo(USER_ID);
        assertThat(command.correlationId()).isEqualTo("req-42");
        assertThat(command.detail()).containsEntry("path", "skip").containsKey("organizationId");
        assertThat(command.occurredAt()).isEqualTo(OCCURRED_AT);
    }

    @Test
    void storageFailuresAreSwallowed() {
        doThrow(new DataAccessResourceFailureException("db down")).when(auditLogService).record(any());

        assertThatCode(() -> sink.emit(new AnalyticsEvent(AnalyticsEvent.ORGANIZATION_CREATED, USER_ID, Map.of(), OCCURRED_AT)))
                .doesNotThrowAnyException();
    }
}
