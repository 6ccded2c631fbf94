package com.z254.butterfly.triage.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging for group lifecycle and alert intake events.
 * <p>
 * Each event is one {@code message | data={json}} line. The group and alert ids are also put in
 * the MDC for the duration of the call so the log pattern can print them.
 */
@Slf4j
@Component
public class TriageStructuredLogger {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_GROUP_ID = "groupId";
    public static final String MDC_ALERT_ID = "alertId";

    private static final ObjectMapper DATA_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public void logGroupEvent(String groupId, GroupEventType eventType, String message,
                              Map<String, Object> details) {
        Map<String, Object> data = eventData(eventType.name(), null, groupId, details);
        try (MDC.MDCCloseable group = MDC.putCloseable(MDC_GROUP_ID, orEmpty(groupId))) {
            emit(eventType.level, message, data);
        }
    }

    public void logAlertEvent(String alertId, String groupId, AlertEventType eventType, String message,
                              Map<String, Object> details) {
        Map<String, Object> data = eventData(eventType.name(), alertId, groupId, details);
        try (MDC.MDCCloseable alert = MDC.putCloseable(MDC_ALERT_ID, orEmpty(alertId));
             MDC.MDCCloseable group = MDC.putCloseable(MDC_GROUP_ID, orEmpty(groupId))) {
            emit(eventType.level, message, data);
        }
    }

    private static Map<String, Object> eventData(String event, String alertId, String groupId,
                                                 Map<String, Object> details) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", event);
        if (alertId != null) {
            data.put("alertId", alertId);
        }
        if (groupId != null) {
            data.put("groupId", groupId);
        }
        if (details != null) {
            data.putAll(details);
        }
        return data;
    }

    private static void emit(Level level, String message, Map<String, Object> data) {
        if (log.isEnabledForLevel(level)) {
            log.atLevel(level).log("{} | data={}", message, toJson(data));
        }
    }

    static String toJson(Map<String, Object> data) {
        try {
            return DATA_MAPPER.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            return String.valueOf(data);
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    public enum GroupEventType {
        GROUP_CREATED(Level.INFO),
        ALERT_GROUPED(Level.DEBUG),
        ROOT_CAUSES_IDENTIFIED(Level.INFO),
        SUPPRESSION_CHANGED(Level.INFO),
        GROUPS_EXPIRED(Level.INFO),
        GROUPS_SAVED(Level.DEBUG),
        GROUPS_LOADED(Level.INFO),
        PERSISTENCE_FAILED(Level.ERROR);

        private final Level level;

        GroupEventType(Level level) {
            this.level = level;
        }
    }

    public enum AlertEventType {
        ALERT_REJECTED(Level.WARN),
        ALERT_SUPPRESSED(Level.INFO),
        ALERT_DUPLICATE(Level.DEBUG);

        private final Level level;

        AlertEventType(Level level) {
            this.level = level;
        }
    }
}
