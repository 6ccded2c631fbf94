package com.z254.butterfly.triage.kafka;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.GroupSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes group summaries to the group-updates topic, keyed by group id so updates of one
 * group stay ordered.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class GroupUpdateProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;

    public GroupUpdateProducer(KafkaTemplate<String, Object> kafkaTemplate, TriageProperties triageProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = triageProperties.getKafka().getTopics().getGroupUpdates();
    }

    public void publish(GroupSummary summary) {
        Map<String, Object> message = mapSummary(summary);

        CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(topic, summary.getGroupId(), message);

        future.whenComplete((sendResult, ex) -> {
            if (ex != null) {
                log.error("Failed to publish update for group {}: {}", summary.getGroupId(), ex.getMessage());
            } else {
                log.debug("Published update for group {} to partition {} offset {}",
                        summary.getGroupId(),
                        sendResult.getRecordMetadata().partition(),
                        sendResult.getRecordMetadata().offset());
            }
        });
    }

    Map<String, Object> mapSummary(GroupSummary summary) {
        Map<String, Object> message = new HashMap<>();
        message.put("groupId", summary.getGroupId());
        message.put("name", summary.getName());
        message.put("alertCount", summary.getAlertCount());
        message.put("createdAt", toEpochMilli(summary.getCreatedAt()));
        message.put("updatedAt", toEpochMilli(summary.getUpdatedAt()));
        message.put("expiresAt", toEpochMilli(summary.getExpiresAt()));
        message.put("active", summary.isActive());
        message.put("suppressionEnabled", summary.isSuppressionEnabled());
        message.put("severityDistribution", summary.getSeverityDistribution());
        message.put("rootCauseCount", summary.getRootCauseCount());
        message.put("mostRecentAlertId", summary.getMostRecentAlertId());
        message.put("mostRecentTime", toEpochMilli(summary.getMostRecentTime()));

        if (summary.getRootCauseIds() != null) {
            message.put("rootCauseIds", summary.getRootCauseIds());
        }
        if (summary.getRootCauseDetails() != null) {
            List<Map<String, Object>> details = new ArrayList<>();
            for (GroupSummary.RootCauseDetail detail : summary.getRootCauseDetails()) {
                Map<String, Object> entry = new HashMap<>();
                entry.put("id", detail.getId());
                entry.put("type", detail.getType());
                entry.put("component", detail.getComponent());
                entry.put("description", detail.getDescription());
                details.add(entry);
            }
            message.put("rootCauseDetails", details);
        }
        return message;
    }

    private static Long toEpochMilli(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }
}
