package com.z254.butterfly.triage.correlation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Restores groups on startup and periodically sweeps expired groups and saves the rest.
 */
@Slf4j
@Component
public class CorrelationMaintenanceJob {

    private final CorrelationEngine engine;

    public CorrelationMaintenanceJob(CorrelationEngine engine) {
        this.engine = engine;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void restoreGroups() {
        int loaded = engine.loadGroups();
        log.info("Restored {} incident groups from store", loaded);
    }

    @Scheduled(fixedDelayString = "${triage.correlation.cleanup-interval:PT5M}",
            initialDelayString = "${triage.correlation.cleanup-interval:PT5M}")
    public void sweep() {
        int removed = engine.cleanupOldGroups();
        boolean saved = engine.saveGroups();
        log.debug("Maintenance sweep removed {} groups, save {}", removed, saved ? "succeeded" : "failed");
    }
}
