package alertgate.suppression;

import alertgate.model.Alert;
import alertgate.model.AlertKind;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SuppressionPolicyTest {

    private static final Instant DETECTED = Instant.parse("2022-06-01T10:00:00Z");
    private static final Instant NOW = Instant.parse("2022-06-02T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final Alert alert = Alert.of("a1", AlertKind.TEST, "k1", DETECTED);

    @Test
    void sentAtOrAfterDetectionBoundary() {
        SuppressionPolicy policy = SuppressionPolicy.sentAtOrAfterDetection();

        assertTrue(policy.isCovered(alert, DETECTED));
        assertTrue(policy.isCovered(alert, DETECTED.plusMillis(1)));
        assertFalse(policy.isCovered(alert, DETECTED.minusMillis(1)));
    }

    @Test
    void sentAfterDetectionBoundary() {
        SuppressionPolicy policy = SuppressionPolicy.sentAfterDetection();

        assertFalse(policy.isCovered(alert, DETECTED));
        assertTrue(policy.isCovered(alert, DETECTED.plusMillis(1)));
    }

    @Test
    void withinIntervalUsesDefaultInterval() {
        SuppressionPolicy policy = SuppressionPolicy.withinInterval(Duration.ofHours(24), CLOCK);

        assertTrue(policy.isCovered(alert, NOW.minus(Duration.ofHours(24))));
        assertTrue(policy.isCovered(alert, NOW.minus(Duration.ofHours(1))));
        assertFalse(policy.isCovered(alert, NOW.minus(Duration.ofHours(24)).minusSeconds(1)));
    }

    @Test
    void withinIntervalPrefersAlertInterval() {
        SuppressionPolicy policy = SuppressionPolicy.withinInterval(Duration.ofHours(24), CLOCK);
        Alert hourly = new Alert("a2", AlertKind.TEST, "k1", DETECTED, Duration.ofHours(1));

        assertFalse(policy.isCovered(hourly, NOW.minus(Duration.ofHours(2))));
        assertTrue(policy.isCovered(hourly, NOW.minus(Duration.ofMinutes(30))));
    }

    @Test
    void zeroIntervalSuppressesOnlyAtNow() {
        SuppressionPolicy policy = SuppressionPolicy.withinInterval(Duration.ZERO, CLOCK);

        assertTrue(policy.isCovered(alert, NOW));
        assertFalse(policy.isCovered(alert, NOW.minusSeconds(1)));
    }

    @Test
    void withinIntervalRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () ->
                SuppressionPolicy.withinInterval(Duration.ofHours(-1), CLOCK));
        assertThrows(NullPointerException.class, () ->
                SuppressionPolicy.withinInterval(null, CLOCK));
        assertThrows(NullPointerException.class, () ->
                SuppressionPolicy.withinInterval(Duration.ZERO, null));
    }

    @Test
    void everyModeBuildsAPolicy() {
        for (SuppressionPolicy.Mode mode : SuppressionPolicy.Mode.values()) {
            assertNotNull(mode.toPolicy(Duration.ofHours(24), CLOCK));
        }
        assertInstanceOf(SuppressionPolicy.class,
                SuppressionPolicy.Mode.WITHIN_INTERVAL.toPolicy(Duration.ofHours(1), CLOCK));
    }
}
