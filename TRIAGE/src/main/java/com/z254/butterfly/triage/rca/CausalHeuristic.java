package com.z254.butterfly.triage.rca;

import com.z254.butterfly.triage.correlation.ContextSimilarity;
import com.z254.butterfly.triage.domain.model.Alert;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether one alert plausibly caused another.
 * <p>
 * Rules, in order:
 * <ol>
 *     <li>the cause was created strictly before the effect</li>
 *     <li>they share a component or execution, or failing that their contexts overlap by at least 0.8</li>
 *     <li>the cause is at most one severity level below the effect</li>
 *     <li>the effect follows within the correlation window</li>
 * </ol>
 * The verdict is {@code sharedComponent || sharedExecution || sharedResourceId}. Alerts that only
 * passed rule 2 through context overlap therefore also need a matching {@code resource_id}.
 */
public class CausalHeuristic {

    static final double CONTEXT_RELATEDNESS_THRESHOLD = 0.8;
    static final String RESOURCE_ID_KEY = "resource_id";

    private final Duration timeWindow;

    public CausalHeuristic(Duration timeWindow) {
        this.timeWindow = timeWindow;
    }

    public boolean isPotentialCause(Alert cause, Alert effect) {
        if (!cause.getCreatedAt().isBefore(effect.getCreatedAt())) {
            return false;
        }

        boolean relatedByComponent = cause.getComponent() != null
                && cause.getComponent().equals(effect.getComponent());
        boolean relatedByExecution = effect.getExecutionId() != null
                && effect.getExecutionId().equals(cause.getExecutionId());

        if (!relatedByComponent && !relatedByExecution
                && ContextSimilarity.jaccard(cause.getContext(), effect.getContext()) < CONTEXT_RELATEDNESS_THRESHOLD) {
            return false;
        }

        if (cause.getSeverity().getWeight() < effect.getSeverity().getWeight() - 1) {
            return false;
        }

        if (Duration.between(cause.getCreatedAt(), effect.getCreatedAt()).compareTo(timeWindow) > 0) {
            return false;
        }

        return relatedByComponent || relatedByExecution || sharesResource(cause, effect);
    }

    private boolean sharesResource(Alert cause, Alert effect) {
        Optional<String> causeResource = cause.contextValue(RESOURCE_ID_KEY);
        return causeResource.isPresent() && causeResource.equals(effect.contextValue(RESOURCE_ID_KEY));
    }
}
