package com.z254.butterfly.triage.api.v1;

import com.z254.butterfly.triage.api.dto.AlertRequest;
import com.z254.butterfly.triage.api.dto.CleanupResponse;
import com.z254.butterfly.triage.api.dto.GroupListResponse;
import com.z254.butterfly.triage.api.dto.IngestResponse;
import com.z254.butterfly.triage.api.dto.SuppressionCheckResponse;
import com.z254.butterfly.triage.api.dto.SuppressionRequest;
import com.z254.butterfly.triage.api.mapper.AlertMapper;
import com.z254.butterfly.triage.correlation.CorrelationEngine;
import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.GroupSummary;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.exception.GroupNotFoundException;
import com.z254.butterfly.triage.ingest.AlertIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import com.z254.butterfly.triage.exception.TriageValidationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * REST API controller for alert ingestion and incident group queries.
 * <p>
 * Engine calls may block on the persistence store, so every handler runs on the bounded
 * elastic scheduler.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class AlertGroupController {

    private final AlertIngestionService ingestionService;
    private final CorrelationEngine engine;

    public AlertGroupController(AlertIngestionService ingestionService, CorrelationEngine engine) {
        this.ingestionService = ingestionService;
        this.engine = engine;
    }

    // ========== Alerts ==========

    @PostMapping("/alerts")
    @Tag(name = "Alerts")
    @Operation(summary = "Ingest alert", description = "Correlate a single alert into an incident group")
    public Mono<ResponseEntity<IngestResponse>> ingestAlert(@Valid @RequestBody AlertRequest request) {
        return Mono.fromCallable(() -> {
            Alert alert = AlertMapper.toDomain(request);
            AlertIngestionService.IngestResult result = ingestionService.ingest(alert);
            return ResponseEntity.ok(IngestResponse.builder()
                    .alertId(alert.getAlertId())
                    .groupId(result.groupId())
                    .suppressed(result.suppressed())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/alerts/batch")
    @Tag(name = "Alerts")
    @Operation(summary = "Ingest alert batch",
               description = "Sweep expired groups, correlate the alerts in order and return all active groups. "
                       + "Elements that cannot be mapped or are incomplete are skipped.")
    public Mono<ResponseEntity<List<GroupSummary>>> ingestBatch(@RequestBody List<AlertRequest> requests) {
        return Mono.fromCallable(() -> ResponseEntity.ok(ingestionService.ingestBatch(toAlerts(requests))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/alerts/suppression-check")
    @Tag(name = "Alerts")
    @Operation(summary = "Check suppression",
               description = "Whether the alert would be suppressed by one group, or by any active group")
    public Mono<ResponseEntity<SuppressionCheckResponse>> checkSuppression(
            @Valid @RequestBody AlertRequest request,
            @Parameter(description = "Group to check; all active groups when omitted")
            @RequestParam(required = false) String groupId) {

        return Mono.fromCallable(() -> {
            Alert alert = AlertMapper.toDomain(request);
            return ResponseEntity.ok(SuppressionCheckResponse.builder()
                    .alertId(alert.getAlertId())
                    .groupId(groupId)
                    .suppress(engine.shouldSuppressAlert(alert, groupId))
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Groups ==========

    @GetMapping("/groups")
    @Tag(name = "Groups")
    @Operation(summary = "List groups", description = "List active incident groups, most recently updated first")
    public Mono<ResponseEntity<GroupListResponse>> listGroups(
            @Parameter(description = "Only groups with a member from this component")
            @RequestParam(required = false) String component,
            @Parameter(description = "Page number")
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @Parameter(description = "Page size")
            @RequestParam(defaultValue = "20") @Min(1) int size) {

        return Mono.fromCallable(() -> {
            List<IncidentGroup> filtered = engine.getAllGroups().values().stream()
                    .filter(g -> component == null
                            || g.getAlerts().stream().anyMatch(a -> component.equals(a.getComponent())))
                    .sorted(Comparator.comparing(IncidentGroup::getUpdatedAt).reversed())
                    .toList();

            return ResponseEntity.ok(GroupListResponse.builder()
                    .groups(filtered.stream()
                            .skip((long) page * size)
                            .limit(size)
                            .map(IncidentGroup::summary)
                            .toList())
                    .total(filtered.size())
                    .page(page)
                    .size(size)
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/groups/{id}")
    @Tag(name = "Groups")
    @Operation(summary = "Get group", description = "Summary of an active incident group")
    public Mono<ResponseEntity<GroupSummary>> getGroup(
            @Parameter(description = "Group ID") @PathVariable String id) {

        return Mono.fromCallable(() -> engine.summarize(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new GroupNotFoundException(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/groups/{id}/root-causes")
    @Tag(name = "Groups")
    @Operation(summary = "Get root causes", description = "Ranked root-cause alerts of an active group")
    public Mono<ResponseEntity<List<Alert>>> getRootCauses(
            @Parameter(description = "Group ID") @PathVariable String id) {

        return Mono.fromCallable(() -> engine.getGroup(id)
                .map(group -> ResponseEntity.ok(group.getRootCauses()))
                .orElseThrow(() -> new GroupNotFoundException(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/groups/{id}/suppression")
    @Tag(name = "Groups")
    @Operation(summary = "Toggle suppression", description = "Enable or disable suppression on an active group")
    public Mono<ResponseEntity<GroupSummary>> setSuppression(
            @Parameter(description = "Group ID") @PathVariable String id,
            @Valid @RequestBody SuppressionRequest request) {

        return Mono.fromCallable(() -> {
            if (!engine.setSuppression(id, request.getEnabled())) {
                throw new GroupNotFoundException(id);
            }
            log.info("Suppression on group {} set to {}", id, request.getEnabled());
            return engine.summarize(id)
                    .map(ResponseEntity::ok)
                    .orElseThrow(() -> new GroupNotFoundException(id));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/groups/cleanup")
    @Tag(name = "Groups")
    @Operation(summary = "Sweep expired groups", description = "Remove expired groups immediately")
    public Mono<ResponseEntity<CleanupResponse>> cleanup() {
        return Mono.fromCallable(() -> {
            int removed = engine.cleanupOldGroups();
            return ResponseEntity.ok(CleanupResponse.builder()
                    .removed(removed)
                    .remaining(engine.activeGroupCount())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static List<Alert> toAlerts(List<AlertRequest> requests) {
        List<Alert> alerts = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            AlertRequest request = requests.get(i);
            if (request == null) {
                log.warn("Skipping null element {} of alert batch", i);
                continue;
            }
            try {
                alerts.add(AlertMapper.toDomain(request));
            } catch (TriageValidationException e) {
                log.warn("Skipping element {} of alert batch ({}): {}", i, request.getAlertId(), e.getMessage());
            }
        }
        return alerts;
    }
}
