package com.z254.butterfly.triage.correlation;

import com.z254.butterfly.triage.domain.model.Alert;

import java.time.Duration;
import java.util.Objects;

/**
 * Pairwise alert similarity in [0, 1].
 * <p>
 * Weighted sum of five factors:
 * <ul>
 *     <li>type match (0.30)</li>
 *     <li>component match (0.20)</li>
 *     <li>execution match (0.20)</li>
 *     <li>context Jaccard similarity (0.20)</li>
 *     <li>temporal proximity within the correlation window (0.10)</li>
 * </ul>
 * Every factor lies in [0, 1] and the weights sum to one, so no clamping is applied.
 * The score is symmetric.
 */
public class SimilarityScorer {

    // Percentage points, so that a perfect match sums to exactly 1.0
    static final int TYPE_WEIGHT = 30;
    static final int COMPONENT_WEIGHT = 20;
    static final int EXECUTION_WEIGHT = 20;
    static final int CONTEXT_WEIGHT = 20;
    static final int TEMPORAL_WEIGHT = 10;
    private static final double WEIGHT_TOTAL = 100.0;

    private final double windowSeconds;

    public SimilarityScorer(Duration timeWindow) {
        if (timeWindow == null || timeWindow.isZero() || timeWindow.isNegative()) {
            throw new IllegalArgumentException("timeWindow must be positive");
        }
        this.windowSeconds = timeWindow.toMillis() / 1000.0;
    }

    public double score(Alert first, Alert second) {
        double typeMatch = Objects.equals(first.getAlertType(), second.getAlertType()) ? 1.0 : 0.0;
        double componentMatch = sameNonNull(first.getComponent(), second.getComponent()) ? 1.0 : 0.0;
        double executionMatch = sameNonNull(first.getExecutionId(), second.getExecutionId()) ? 1.0 : 0.0;
        double contextSimilarity = ContextSimilarity.jaccard(first.getContext(), second.getContext());
        double temporalSimilarity = temporalSimilarity(first, second);

        return (TYPE_WEIGHT * typeMatch
                + COMPONENT_WEIGHT * componentMatch
                + EXECUTION_WEIGHT * executionMatch
                + CONTEXT_WEIGHT * contextSimilarity
                + TEMPORAL_WEIGHT * temporalSimilarity) / WEIGHT_TOTAL;
    }

    /**
     * Linear decay from 1.0 at zero distance to 0.0 at the window edge, floored at zero beyond it.
     */
    double temporalSimilarity(Alert first, Alert second) {
        double diffSeconds = Math.abs(Duration.between(first.getCreatedAt(), second.getCreatedAt()).toMillis()) / 1000.0;
        return Math.max(0.0, 1.0 - diffSeconds / windowSeconds);
    }

    static boolean sameNonNull(String left, String right) {
        return left != null && left.equals(right);
    }
}
