package com.z254.butterfly.triage.support;

import com.z254.butterfly.triage.domain.model.Alert;
import com.z254.butterfly.triage.domain.model.AlertSeverity;

import java.time.Instant;
import java.util.Map;

/**
 * Alert fixtures anchored at a fixed instant.
 */
public final class TestAlerts {

    public static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private TestAlerts() {}

    /**
     * Builder preset with an id, type {@code timeout}, severity MEDIUM, created at {@link #T0}.
     */
    public static Alert.AlertBuilder alert(String alertId) {
        return Alert.builder()
                .alertId(alertId)
                .alertType("timeout")
                .severity(AlertSeverity.MEDIUM)
                .createdAt(T0)
                .description("Alert " + alertId);
    }

    public static Alert.AlertBuilder alertAt(String alertId, long secondsAfterT0) {
        return alert(alertId).createdAt(T0.plusSeconds(secondsAfterT0));
    }

    /**
     * Alert sharing nothing with other {@code unrelated} alerts except its timestamp offset.
     */
    public static Alert unrelated(String alertId, long secondsAfterT0) {
        return alertAt(alertId, secondsAfterT0)
                .alertType("type-" + alertId)
                .component("component-" + alertId)
                .executionId("exec-" + alertId)
                .context(Map.of("host", "host-" + alertId))
                .build();
    }
}
