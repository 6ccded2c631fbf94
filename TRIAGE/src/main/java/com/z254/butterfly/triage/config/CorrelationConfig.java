package com.z254.butterfly.triage.config;

import com.z254.butterfly.triage.correlation.CorrelationEngine;
import com.z254.butterfly.triage.domain.repository.AlertRepository;
import com.z254.butterfly.triage.domain.repository.GroupSnapshotRepository;
import com.z254.butterfly.triage.domain.repository.InMemoryAlertRepository;
import com.z254.butterfly.triage.domain.repository.InMemoryGroupSnapshotRepository;
import com.z254.butterfly.triage.observability.TriageMetrics;
import com.z254.butterfly.triage.observability.TriageStructuredLogger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the correlation engine and its default in-memory stores.
 */
@Configuration
public class CorrelationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "triage.persistence.store", havingValue = "in-memory", matchIfMissing = true)
    public GroupSnapshotRepository inMemoryGroupSnapshotRepository() {
        return new InMemoryGroupSnapshotRepository();
    }

    @Bean
    @ConditionalOnProperty(name = "triage.persistence.store", havingValue = "in-memory", matchIfMissing = true)
    public AlertRepository inMemoryAlertRepository(TriageProperties properties) {
        return new InMemoryAlertRepository(properties.getPersistence().getAlertRetention());
    }

    @Bean
    public CorrelationEngine correlationEngine(TriageProperties properties,
                                               GroupSnapshotRepository snapshotRepository,
                                               AlertRepository alertRepository,
                                               Clock clock,
                                               TriageMetrics metrics,
                                               TriageStructuredLogger structuredLogger) {
        return new CorrelationEngine(properties.getCorrelation().toSettings(),
                snapshotRepository, alertRepository, clock, metrics, structuredLogger);
    }
}
