package com.z254.butterfly.triage.rca;

import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root-cause selection within a single incident group.
 * <p>
 * Pipeline:
 * <ol>
 *     <li>Evaluate {@link CausalHeuristic} for every ordered member pair</li>
 *     <li>Keep members that cause something and are either never an effect or cause more than they suffer</li>
 *     <li>Fall back to the earliest member when nothing qualifies</li>
 *     <li>Above {@value #MAX_ROOT_CAUSES} candidates, rank by severity then age and keep the head</li>
 * </ol>
 * Cost is quadratic in the group size, which the engine bounds.
 */
@Slf4j
public class RootCauseAnalyzer {

    public static final int MAX_ROOT_CAUSES = 3;

    private static final Comparator<Alert> RANKING = Comparator
            .comparingInt((Alert alert) -> alert.getSeverity().getPriority())
            .thenComparing(Alert::getCreatedAt);

    private final CausalHeuristic causalHeuristic;

    public RootCauseAnalyzer(CausalHeuristic causalHeuristic) {
        this.causalHeuristic = causalHeuristic;
    }

    /**
     * @return up to {@value #MAX_ROOT_CAUSES} members of the group, empty for groups under two members
     */
    public List<Alert> identifyRootCauses(IncidentGroup group) {
        List<Alert> alerts = group.getAlerts();
        if (alerts.size() < 2) {
            return List.of();
        }

        // causes[id] = alerts this alert caused, effects[id] = alerts that caused this alert
        Map<String, List<Alert>> causes = new HashMap<>();
        Map<String, List<Alert>> effects = new HashMap<>();

        for (int i = 0; i < alerts.size(); i++) {
            for (int j = 0; j < alerts.size(); j++) {
                if (i == j) {
                    continue;
                }
                Alert cause = alerts.get(i);
                Alert effect = alerts.get(j);
                if (causalHeuristic.isPotentialCause(cause, effect)) {
                    causes.computeIfAbsent(cause.getAlertId(), k -> new ArrayList<>()).add(effect);
                    effects.computeIfAbsent(effect.getAlertId(), k -> new ArrayList<>()).add(cause);
                }
            }
        }

        List<Alert> candidates = new ArrayList<>();
        for (Alert alert : alerts) {
            List<Alert> caused = causes.get(alert.getAlertId());
            if (caused == null) {
                continue;
            }
            List<Alert> causedBy = effects.get(alert.getAlertId());
            if (causedBy == null || caused.size() > causedBy.size()) {
                candidates.add(alert);
            }
        }

        if (candidates.isEmpty()) {
            alerts.stream()
                    .min(Comparator.comparing(Alert::getCreatedAt))
                    .ifPresent(candidates::add);
            log.debug("No causal root in group {}, falling back to earliest alert", group.getGroupId());
        }

        if (candidates.size() > MAX_ROOT_CAUSES) {
            candidates.sort(RANKING);
            return List.copyOf(candidates.subList(0, MAX_ROOT_CAUSES));
        }
        return List.copyOf(candidates);
    }
}
