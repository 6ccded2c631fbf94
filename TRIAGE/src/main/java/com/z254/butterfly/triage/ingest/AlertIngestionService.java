package com.z254.butterfly.triage.ingest;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.correlation.CorrelationEngine;
import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.GroupSummary;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.kafka.GroupUpdateProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point shared by the Kafka consumer and the REST API. Hands alerts to the correlation
 * engine, through its suppression gate when enabled, and publishes the resulting group summaries.
 */
@Slf4j
@Service
public class AlertIngestionService {

    private final CorrelationEngine engine;
    private final Optional<GroupUpdateProducer> groupUpdateProducer;
    private final TriageProperties triageProperties;

    public AlertIngestionService(CorrelationEngine engine,
                                 Optional<GroupUpdateProducer> groupUpdateProducer,
                                 TriageProperties triageProperties) {
        this.engine = engine;
        this.groupUpdateProducer = groupUpdateProducer;
        this.triageProperties = triageProperties;
    }

    /**
     * Outcome of ingesting a single alert. {@code groupId} is null when the alert was suppressed.
     */
    public record IngestResult(String groupId, boolean suppressed) {
    }

    /**
     * @throws com.z254.butterfly.triage.exception.InvalidAlertException if the alert is malformed
     */
    public IngestResult ingest(Alert alert) {
        Optional<String> groupId = suppressOnIngest()
                ? engine.processUnlessSuppressed(alert)
                : Optional.of(engine.processAlert(alert));
        if (groupId.isEmpty()) {
            return new IngestResult(null, true);
        }

        engine.summarize(groupId.get()).ifPresent(this::publish);
        return new IngestResult(groupId.get(), false);
    }

    /**
     * Correlate a batch in order. Invalid alerts are skipped by the engine.
     *
     * @return summaries of every active group after the batch
     */
    public List<GroupSummary> ingestBatch(List<Alert> alerts) {
        Map<String, IncidentGroup> groups = engine.correlateAlerts(alerts, suppressOnIngest());
        List<GroupSummary> summaries = groups.values().stream().map(IncidentGroup::summary).toList();
        summaries.forEach(this::publish);
        log.debug("Batch of {} alerts produced {} active groups", alerts.size(), summaries.size());
        return summaries;
    }

    private boolean suppressOnIngest() {
        return triageProperties.getCorrelation().isSuppressOnIngest();
    }

    private void publish(GroupSummary summary) {
        groupUpdateProducer.ifPresent(producer -> producer.publish(summary));
    }
}
