package com.z254.butterfly.triage.kafka;

import com.z254.butterfly.triage.config.TriageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Routes alert records that could not be correlated to the DLQ topic with the rejection reason.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class AlertDeadLetterProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final Clock clock;

    public AlertDeadLetterProducer(KafkaTemplate<String, Object> kafkaTemplate,
                                   TriageProperties triageProperties,
                                   Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = triageProperties.getKafka().getTopics().getAlertsDlq();
        this.clock = clock;
    }

    /**
     * @param key     original record key, may be null
     * @param payload original record value, may be null when it could not be decoded
     */
    public void send(String key, Object payload, String reason) {
        Map<String, Object> message = new HashMap<>();
        message.put("payload", payload);
        message.put("reason", reason);
        message.put("rejectedAt", clock.millis());

        kafkaTemplate.send(topic, key, message).whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to dead-letter alert record {}: {}", key, ex.getMessage());
            } else {
                log.debug("Dead-lettered alert record {}: {}", key, reason);
            }
        });
    }
}
