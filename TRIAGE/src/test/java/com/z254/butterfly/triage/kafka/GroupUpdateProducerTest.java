package com.z254.butterfly.triage.kafka;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.GroupSummary;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link GroupUpdateProducer}.
 */
@ExtendWith(MockitoExtension.class)
class GroupUpdateProducerTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Captor
    private ArgumentCaptor<Map<String, Object>> messageCaptor;

    private TriageProperties triageProperties;
    private GroupUpdateProducer producer;

    @BeforeEach
    void setUp() {
        triageProperties = new TriageProperties();
        producer = new GroupUpdateProducer(kafkaTemplate, triageProperties);
    }

    @Test
    @DisplayName("should publish to the group updates topic keyed by group id")
    void publishKeyedByGroup() {
        when(kafkaTemplate.send(anyString(), eq("g-1"), any())).thenReturn(createSuccessfulFuture());

        producer.publish(summary(List.of("a")));

        verify(kafkaTemplate).send(eq("triage.groups.updated"), eq("g-1"), messageCaptor.capture());
        Map<String, Object> message = messageCaptor.getValue();
        assertThat(message)
                .containsEntry("groupId", "g-1")
                .containsEntry("alertCount", 2)
                .containsEntry("createdAt", CREATED.toEpochMilli())
                .containsEntry("rootCauseIds", List.of("a"));
        assertThat(message.get("rootCauseDetails")).asList().hasSize(1);
    }

    @Test
    @DisplayName("should omit root cause fields for groups without root causes")
    void omitsEmptyRootCauses() {
        Map<String, Object> message = producer.mapSummary(summary(null));

        assertThat(message).doesNotContainKeys("rootCauseIds", "rootCauseDetails");
        assertThat(message).containsEntry("rootCauseCount", 0);
    }

    @Test
    @DisplayName("should not throw when the send fails")
    void sendFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("broker down")));

        producer.publish(summary(null));

        verify(kafkaTemplate).send(eq("triage.groups.updated"), eq("g-1"), any());
    }

    private GroupSummary summary(List<String> rootCauseIds) {
        GroupSummary.GroupSummaryBuilder builder = GroupSummary.builder()
                .groupId("g-1")
                .name("timeout - api")
                .alertCount(2)
                .createdAt(CREATED)
                .updatedAt(CREATED.plusSeconds(5))
                .expiresAt(CREATED.plusSeconds(3600))
                .active(true)
                .severityDistribution(Map.of("MEDIUM", 2))
                .rootCauseCount(rootCauseIds == null ? 0 : rootCauseIds.size())
                .mostRecentAlertId("b")
                .mostRecentTime(CREATED.plusSeconds(5));
        if (rootCauseIds != null) {
            builder.rootCauseIds(rootCauseIds)
                    .rootCauseDetails(rootCauseIds.stream()
                            .map(id -> GroupSummary.RootCauseDetail.builder().id(id).type("timeout").build())
                            .toList());
        }
        return builder.build();
    }

    private CompletableFuture<SendResult<String, Object>> createSuccessfulFuture() {
        RecordMetadata metadata = new RecordMetadata(
                new TopicPartition("triage.groups.updated", 0),
                0L, 0, 0L, 0, 0
        );
        ProducerRecord<String, Object> record = new ProducerRecord<>("triage.groups.updated", "g-1", "value");
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }
}
