package com.z254.butterfly.triage.ingest;

import com.z254.butterfly.triage.exception.InvalidAlertException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.z254.butterfly.triage.support.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AlertValidatorTest {

    private final AlertValidator validator = new AlertValidator();

    @Test
    @DisplayName("should accept an alert with only the required fields")
    void acceptsMinimalAlert() {
        assertThatCode(() -> validator.validate(alert("a").component(null).executionId(null).build()))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should report every missing field at once")
    void reportsAllViolations() {
        InvalidAlertException error = catchThrowableOfType(
                () -> validator.validate(alert("a").alertType("").severity(null).createdAt(null).build()),
                InvalidAlertException.class);

        assertThat(error).isNotNull();
        assertThat(error.getAlertId()).isEqualTo("a");
        assertThat(error.getViolations()).containsExactly(
                "alertType is required", "severity is required", "createdAt is required");
    }

    @Test
    @DisplayName("should reject a blank id without naming it")
    void blankId() {
        InvalidAlertException error = catchThrowableOfType(
                () -> validator.validate(alert(" ").build()), InvalidAlertException.class);

        assertThat(error.getAlertId()).isNull();
        assertThat(error).hasMessageStartingWith("Invalid alert <no id>");
    }

    @Test
    @DisplayName("should reject a null alert")
    void nullAlert() {
        assertThat(catchThrowableOfType(() -> validator.validate(null), InvalidAlertException.class))
                .isNotNull();
    }
}
