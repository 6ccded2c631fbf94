package com.z254.butterfly.triage.kafka;

import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.AlertSeverity;
import com.z254.butterfly.triage.exception.TriageValidationException;
import com.z254.butterfly.triage.ingest.AlertIngestionService;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kafka consumer for detector alerts.
 * Consumes JSON alert records, correlates them and dead-letters records that cannot be used.
 * Records are always acknowledged; a bad record never blocks its partition.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class AlertEventConsumer {

    private final AlertIngestionService ingestionService;
    private final AlertDeadLetterProducer deadLetterProducer;

    public AlertEventConsumer(AlertIngestionService ingestionService,
                              AlertDeadLetterProducer deadLetterProducer) {
        this.ingestionService = ingestionService;
        this.deadLetterProducer = deadLetterProducer;
    }

    @KafkaListener(
            topics = "${triage.kafka.topics.alerts-input:triage.alerts.detected}",
            groupId = "${spring.kafka.consumer.group-id:triage-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, Map<String, Object>> record, Acknowledgment ack) {
        Map<String, Object> data = record.value();
        try {
            if (data == null) {
                deadLetterProducer.send(record.key(), null, "Record value could not be decoded");
                return;
            }

            String alertId = string(data, "alertId", "alert_id");
            putMdc(TriageStructuredLogger.MDC_ALERT_ID, alertId);
            putMdc(TriageStructuredLogger.MDC_CORRELATION_ID, string(data, "correlationId", "correlation_id"));
            log.debug("Received alert {} from partition {} offset {}", alertId, record.partition(), record.offset());

            Alert alert = mapToAlert(data);
            AlertIngestionService.IngestResult result = ingestionService.ingest(alert);
            if (result.suppressed()) {
                log.debug("Alert {} suppressed", alertId);
            }
        } catch (TriageValidationException e) {
            deadLetterProducer.send(record.key(), data, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to correlate alert record at offset {}: {}", record.offset(), e.getMessage(), e);
            deadLetterProducer.send(record.key(), data, "Processing failed: " + e.getMessage());
        } finally {
            ack.acknowledge();
            MDC.remove(TriageStructuredLogger.MDC_ALERT_ID);
            MDC.remove(TriageStructuredLogger.MDC_CORRELATION_ID);
        }
    }

    /**
     * Map a decoded record to an alert. Both camelCase and snake_case keys are accepted;
     * {@code createdAt} may be epoch millis or an ISO-8601 instant.
     */
    Alert mapToAlert(Map<String, Object> data) {
        return Alert.builder()
                .alertId(string(data, "alertId", "alert_id"))
                .alertType(string(data, "alertType", "alert_type"))
                .component(string(data, "component", "component"))
                .executionId(string(data, "executionId", "execution_id"))
                .severity(AlertSeverity.fromValue(string(data, "severity", "severity")))
                .context(context(value(data, "context", "context")))
                .createdAt(instant(value(data, "createdAt", "created_at")))
                .description(string(data, "description", "description"))
                .build();
    }

    private static Object value(Map<String, Object> data, String key, String alternateKey) {
        Object value = data.get(key);
        return value != null ? value : data.get(alternateKey);
    }

    private static String string(Map<String, Object> data, String key, String alternateKey) {
        Object value = value(data, key, alternateKey);
        return value != null ? value.toString() : null;
    }

    private static Map<String, String> context(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, String> context = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (k != null && v != null) {
                context.put(k.toString(), v.toString());
            }
        });
        return context;
    }

    private static Instant instant(Object raw) {
        if (raw instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new TriageValidationException("Unparseable createdAt: " + text, e);
            }
        }
        return null;
    }

    private static void putMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
