package com.z254.butterfly.triage.correlation;

import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.AlertSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.z254.butterfly.triage.support.TestAlerts.alert;
import static com.z254.butterfly.triage.support.TestAlerts.alertAt;
import static com.z254.butterfly.triage.support.TestAlerts.unrelated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SimilarityScorer}.
 */
class SimilarityScorerTest {

    private final SimilarityScorer scorer = new SimilarityScorer(Duration.ofMinutes(60));

    @Nested
    @DisplayName("Score properties")
    class PropertyTests {

        @Test
        @DisplayName("fully populated alert scores exactly 1.0 against itself")
        void selfSimilarity() {
            Alert a = alert("a")
                    .component("ingest-job-7")
                    .executionId("exec-1")
                    .context(Map.of("resource_id", "r-1", "region", "eu"))
                    .build();

            assertThat(scorer.score(a, a)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("score is symmetric and within [0, 1]")
        void symmetricAndBounded() {
            List<Alert> alerts = List.of(
                    alert("a").component("svc").context(Map.of("k", "v")).build(),
                    alertAt("b", 30).component("svc").executionId("e").build(),
                    alertAt("c", 7200).alertType("oom").context(Map.of("k", "v", "x", "y")).build(),
                    unrelated("d", 5),
                    alertAt("e", -100).severity(AlertSeverity.CRITICAL).build());

            for (Alert first : alerts) {
                for (Alert second : alerts) {
                    double forward = scorer.score(first, second);
                    assertThat(forward).isEqualTo(scorer.score(second, first));
                    assertThat(forward).isBetween(0.0, 1.0);
                }
            }
        }
    }

    @Nested
    @DisplayName("Factor weights")
    class FactorTests {

        @Test
        @DisplayName("type and component match five seconds apart stays below 0.7")
        void typeAndComponentOnly() {
            Alert a = alert("a").component("ingest-job-7").build();
            Alert b = alertAt("b", 5).component("ingest-job-7").build();

            // 0.3 + 0.2 + 0.1 * (1 - 5/3600)
            assertThat(scorer.score(a, b)).isCloseTo(0.59986, within(1e-5));
        }

        @Test
        @DisplayName("matching execution adds 0.2")
        void executionMatch() {
            Alert a = alert("a").component("ingest-job-7").executionId("exec-1").build();
            Alert b = alertAt("b", 5).component("ingest-job-7").executionId("exec-1").build();

            assertThat(scorer.score(a, b)).isCloseTo(0.79986, within(1e-5));
        }

        @Test
        @DisplayName("null components and executions never match")
        void nullKeysDoNotMatch() {
            Alert a = alert("a").alertType("x").build();
            Alert b = alert("b").alertType("y").build();

            // Only the temporal factor contributes
            assertThat(scorer.score(a, b)).isCloseTo(0.1, within(1e-12));
        }

        @Test
        @DisplayName("context contributes Jaccard over key:value pairs")
        void contextJaccard() {
            Alert a = alert("a").alertType("x").context(Map.of("a", "1", "b", "2")).build();
            Alert b = alert("b").alertType("y").context(Map.of("a", "1", "c", "3")).build();

            assertThat(scorer.score(a, b)).isCloseTo(0.2 / 3 + 0.1, within(1e-12));
        }

        @Test
        @DisplayName("same key with different value is not shared")
        void contextValueMismatch() {
            assertThat(ContextSimilarity.jaccard(Map.of("host", "a"), Map.of("host", "b"))).isZero();
        }

        @Test
        @DisplayName("empty context on either side contributes nothing")
        void emptyContext() {
            assertThat(ContextSimilarity.jaccard(Map.of(), Map.of("k", "v"))).isZero();
            assertThat(ContextSimilarity.jaccard(Map.of(), Map.of())).isZero();
            assertThat(ContextSimilarity.jaccard(Map.of("k", "v"), Map.of("k", "v"))).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Temporal decay")
    class TemporalTests {

        @Test
        @DisplayName("decays linearly inside the window")
        void linearDecay() {
            assertThat(scorer.temporalSimilarity(alert("a").build(), alertAt("b", 1800).build()))
                    .isCloseTo(0.5, within(1e-12));
        }

        @Test
        @DisplayName("floors at zero beyond the window")
        void floorsAtZero() {
            assertThat(scorer.temporalSimilarity(alert("a").build(), alertAt("b", 3600).build())).isZero();
            assertThat(scorer.temporalSimilarity(alert("a").build(), alertAt("b", 3 * 3600).build())).isZero();
            assertThat(scorer.score(unrelated("a", 0), unrelated("b", 10_000))).isZero();
        }

        @Test
        @DisplayName("rejects a non-positive window")
        void rejectsNonPositiveWindow() {
            assertThatThrownBy(() -> new SimilarityScorer(Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
