package com.z254.butterfly.triage.rca;

import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.AlertSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static com.z254.butterfly.triage.support.TestAlerts.alert;
import static com.z254.butterfly.triage.support.TestAlerts.alertAt;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CausalHeuristic}.
 */
class CausalHeuristicTest {

    private final CausalHeuristic heuristic = new CausalHeuristic(Duration.ofMinutes(60));

    @Nested
    @DisplayName("Precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("earlier critical alert on the same component causes a later medium one")
        void earlierCausesLater() {
            Alert cause = alert("a").component("svc").severity(AlertSeverity.CRITICAL).build();
            Alert effect = alertAt("b", 30).component("svc").severity(AlertSeverity.MEDIUM).build();

            assertThat(heuristic.isPotentialCause(cause, effect)).isTrue();
            assertThat(heuristic.isPotentialCause(effect, cause)).isFalse();
        }

        @Test
        @DisplayName("simultaneous alerts never cause each other")
        void simultaneous() {
            Alert a = alert("a").component("svc").build();
            Alert b = alert("b").component("svc").build();

            assertThat(heuristic.isPotentialCause(a, b)).isFalse();
            assertThat(heuristic.isPotentialCause(b, a)).isFalse();
        }
    }

    @Nested
    @DisplayName("Relatedness")
    class RelatednessTests {

        @Test
        @DisplayName("shared execution relates alerts on different components")
        void sharedExecution() {
            Alert cause = alert("a").component("x").executionId("exec-1").build();
            Alert effect = alertAt("b", 10).component("y").executionId("exec-1").build();

            assertThat(heuristic.isPotentialCause(cause, effect)).isTrue();
        }

        @Test
        @DisplayName("null components are not a shared component")
        void nullComponents() {
            Alert cause = alert("a").build();
            Alert effect = alertAt("b", 10).build();

            assertThat(heuristic.isPotentialCause(cause, effect)).isFalse();
        }

        @Test
        @DisplayName("high context overlap with a shared resource_id relates alerts")
        void contextFallbackWithResource() {
            Map<String, String> context = Map.of("resource_id", "disk-1", "region", "eu", "rack", "r7");
            Alert cause = alert("a").component("x").context(context).build();
            Alert effect = alertAt("b", 10).component("y").context(context).build();

            assertThat(heuristic.isPotentialCause(cause, effect)).isTrue();
        }

        @Test
        @DisplayName("high context overlap without resource_id is not enough")
        void contextFallbackWithoutResource() {
            Map<String, String> context = Map.of("region", "eu", "rack", "r7");
            Alert cause = alert("a").component("x").context(context).build();
            Alert effect = alertAt("b", 10).component("y").context(context).build();

            assertThat(heuristic.isPotentialCause(cause, effect)).isFalse();
        }

        @Test
        @DisplayName("shared resource_id alone does not pass the overlap threshold")
        void resourceWithoutOverlap() {
            Alert cause = alert("a").component("x")
                    .context(Map.of("resource_id", "disk-1", "region", "eu")).build();
            Alert effect = alertAt("b", 10).component("y")
                    .context(Map.of("resource_id", "disk-1", "region", "us")).build();

            assertThat(heuristic.isPotentialCause(cause, effect)).isFalse();
        }
    }

    @Nested
    @DisplayName("Severity and window")
    class SeverityAndWindowTests {

        @Test
        @DisplayName("cause may be one level less severe than the effect")
        void oneLevelBelow() {
            Alert cause = alert("a").component("svc").severity(AlertSeverity.HIGH).build();
            Alert effect = alertAt("b", 10).component("svc").severity(AlertSeverity.CRITICAL).build();

            assertThat(heuristic.isPotentialCause(cause, effect)).isTrue();
        }

        @Test
        @DisplayName("cause two levels less severe is rejected")
        void twoLevelsBelow() {
            Alert cause = alert("a").component("svc").severity(AlertSeverity.MEDIUM).build();
            Alert effect = alertAt("b", 10).component("svc").severity(AlertSeverity.CRITICAL).build();

            assertThat(heuristic.isPotentialCause(cause, effect)).isFalse();
        }

        @Test
        @DisplayName("effect exactly at the window edge still qualifies")
        void windowEdge() {
            Alert cause = alert("a").component("svc").build();

            assertThat(heuristic.isPotentialCause(cause, alertAt("b", 3600).component("svc").build())).isTrue();
            assertThat(heuristic.isPotentialCause(cause, alertAt("c", 3601).component("svc").build())).isFalse();
        }
    }
}
