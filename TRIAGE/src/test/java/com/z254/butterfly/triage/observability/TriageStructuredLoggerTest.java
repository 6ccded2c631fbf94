package com.z254.butterfly.triage.observability;

import com.z254.butterfly.triage.observability.TriageStructuredLogger.AlertEventType;
import com.z254.butterfly.triage.observability.TriageStructuredLogger.GroupEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Unit tests for {@link TriageStructuredLogger}.
 */
class TriageStructuredLoggerTest {

    private final TriageStructuredLogger structuredLogger = new TriageStructuredLogger();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("MDC ids are removed once the event is logged")
    void mdcCleared() {
        MDC.put(TriageStructuredLogger.MDC_CORRELATION_ID, "corr-1");

        structuredLogger.logAlertEvent("a", "g-1", AlertEventType.ALERT_REJECTED, "Rejected alert",
                Map.of("violations", List.of("alertType is required")));
        structuredLogger.logGroupEvent("g-1", GroupEventType.PERSISTENCE_FAILED, "Store failed", null);

        assertThat(MDC.get(TriageStructuredLogger.MDC_ALERT_ID)).isNull();
        assertThat(MDC.get(TriageStructuredLogger.MDC_GROUP_ID)).isNull();
        assertThat(MDC.get(TriageStructuredLogger.MDC_CORRELATION_ID)).isEqualTo("corr-1");
    }

    @Test
    @DisplayName("null ids and details are tolerated")
    void nullsTolerated() {
        assertThatCode(() -> structuredLogger.logAlertEvent(null, null, AlertEventType.ALERT_SUPPRESSED,
                "Suppressed redundant alert", null)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("event data is rendered as JSON with ISO timestamps")
    void dataAsJson() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", "GROUPS_SAVED");
        data.put("note", "quote \" and\nnewline");
        data.put("at", Instant.parse("2024-05-01T12:00:00Z"));

        assertThat(TriageStructuredLogger.toJson(data))
                .isEqualTo("{\"event\":\"GROUPS_SAVED\",\"note\":\"quote \\\" and\\nnewline\",\"at\":\"2024-05-01T12:00:00Z\"}");
    }
}
