package com.fleetrank.core.detection;

import com.fleetrank.core.config.DetectionSettings;
import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.model.AnomalyLabel;
import com.fleetrank.core.model.AnomalyResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.fleetrank.core.TestSeries.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ThresholdDetectionEngine}.
 */
class ThresholdDetectionEngineTest {

    @Test
    @DisplayName("Should score the share of samples strictly above the threshold")
    void shouldScoreShareAboveThreshold() {
        AnomalyResult result = engine(80.0).detect(series("t1", "c1", "n1", "cpu", 50, 90, 95, 80)).get(0);

        assertThat(result.getAnomalyScore()).isEqualTo(0.5);
        assertThat(result.getMagnitude()).hasValueSatisfying(m -> assertThat(m).isCloseTo(0.1875, within(1e-9)));
        assertThat(result.isAnomalous()).isTrue();
        assertThat(result.getExplanation()).hasValueSatisfying(e -> assertThat(e).contains("2 of 4 sample(s) above"));
    }

    @Test
    @DisplayName("Should NOT fire when every sample is at or below the threshold")
    void shouldNotFireBelowThreshold() {
        AnomalyResult result = engine(80.0).detect(series("t1", "c1", "n1", "cpu", 10, 20, 80)).get(0);

        assertThat(result.getAnomalyScore()).isZero();
        assertThat(result.getAnomalyLabel()).isEqualTo(AnomalyLabel.NORMAL);
        assertThat(result.getMagnitude()).isEmpty();
    }

    @Test
    @DisplayName("Should use full magnitude when the threshold is zero")
    void shouldHandleZeroThreshold() {
        AnomalyResult result = engine(0.0).detect(series("t1", "c1", "n1", "errors", 0, 3)).get(0);

        assertThat(result.getMagnitude()).contains(1.0);
    }

    @Test
    @DisplayName("Should require a threshold value")
    void shouldRequireThreshold() {
        DetectionSettings settings = new DetectionSettings();
        settings.setEngine("threshold");

        assertThatThrownBy(() -> new ThresholdDetectionEngine(settings))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("threshold");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ThresholdDetectionEngine engine(double threshold) {
        DetectionSettings settings = new DetectionSettings();
        settings.setEngine("threshold");
        settings.setThreshold(threshold);
        return new ThresholdDetectionEngine(settings);
    }
}
