package com.z254.butterfly.triage.correlation;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Jaccard similarity over alert context maps, each entry flattened to a {@code key:value} string.
 */
public final class ContextSimilarity {

    private ContextSimilarity() {}

    /**
     * @return intersection over union of the two pair sets, or 0.0 when either context is empty
     */
    public static double jaccard(Map<String, String> left, Map<String, String> right) {
        if (left == null || left.isEmpty() || right == null || right.isEmpty()) {
            return 0.0;
        }

        Set<String> leftPairs = toPairs(left);
        Set<String> rightPairs = toPairs(right);

        Set<String> union = new HashSet<>(leftPairs);
        union.addAll(rightPairs);

        Set<String> intersection = new HashSet<>(leftPairs);
        intersection.retainAll(rightPairs);

        return (double) intersection.size() / union.size();
    }

    private static Set<String> toPairs(Map<String, String> context) {
        Set<String> pairs = new HashSet<>(context.size() * 2);
        context.forEach((key, value) -> pairs.add(key + ":" + value));
        return pairs;
    }
}
