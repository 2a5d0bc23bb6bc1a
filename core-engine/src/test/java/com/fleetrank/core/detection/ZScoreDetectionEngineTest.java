package com.fleetrank.core.detection;

import com.fleetrank.core.config.DetectionSettings;
import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.model.AnomalyLabel;
import com.fleetrank.core.model.AnomalyResult;
import com.fleetrank.core.model.MetricSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fleetrank.core.TestSeries.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreDetectionEngine}.
 */
class ZScoreDetectionEngineTest {

    private ZScoreDetectionEngine engine;

    @BeforeEach
    void setUp() {
        DetectionSettings settings = new DetectionSettings();
        settings.setEngine("zscore");
        settings.setDeviationFactor(2.0);
        settings.setMinSamples(3);
        engine = new ZScoreDetectionEngine(settings);
    }

    @Test
    @DisplayName("Should score 0 when the window has fewer than minSamples values")
    void shouldScoreZeroWithInsufficientData() {
        AnomalyResult result = single(series("t1", "c1", "n1", "cpu", 10, 500));

        assertThat(result.getAnomalyScore()).isZero();
        assertThat(result.getAnomalyLabel()).isEqualTo(AnomalyLabel.NORMAL);
    }

    @Test
    @DisplayName("Should NOT flag values close to the mean")
    void shouldNotFlagNormalValues() {
        AnomalyResult result = single(series("t1", "c1", "n1", "cpu", 100, 101, 102, 103, 104));

        assertThat(result.getAnomalyScore()).isCloseTo(Math.sqrt(2) / 4, within(1e-9));
        assertThat(result.getAnomalyLabel()).isEqualTo(AnomalyLabel.NORMAL);
        assertThat(result.isAnomalous()).isFalse();
    }

    @Test
    @DisplayName("Should flag an extreme outlier as a spike")
    void shouldFlagOutlier() {
        MetricSeries s = series("t1", "c1", "n1", "cpu", 10, 10, 10, 10, 10, 10, 10, 10, 10, 100);

        AnomalyResult result = single(s);

        // population sigma = 27, max deviation = 81 -> z = 3 -> 3 / (2 * 2)
        assertThat(result.getAnomalyScore()).isCloseTo(0.75, within(1e-9));
        assertThat(result.getAnomalyLabel()).isEqualTo(AnomalyLabel.SPIKE);
        assertThat(result.getMagnitude()).contains(1.0);
        assertThat(result.getExplanation()).hasValueSatisfying(e -> assertThat(e).startsWith("Spike detected"));
        assertThat(result.getEngineName()).contains("zscore");
        assertThat(result.matches(s)).isTrue();
    }

    @Test
    @DisplayName("Should score 0 when all values are identical")
    void shouldScoreZeroForConstantWindow() {
        AnomalyResult result = single(series("t1", "c1", "n1", "cpu", 100, 100, 100, 100));

        assertThat(result.getAnomalyScore()).isZero();
        assertThat(result.getMagnitude()).contains(0.0);
    }

    @Test
    @DisplayName("Should cap the score at 1")
    void shouldCapScore() {
        DetectionSettings strict = new DetectionSettings();
        strict.setDeviationFactor(0.5);

        AnomalyResult result = new ZScoreDetectionEngine(strict)
                .detect(series("t1", "c1", "n1", "cpu", 10, 10, 10, 10, 10, 10, 10, 10, 10, 100)).get(0);

        assertThat(result.getAnomalyScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a non-positive deviation factor")
    void shouldRejectInvalidSettings() {
        DetectionSettings settings = new DetectionSettings();
        settings.setDeviationFactor(0);

        assertThatThrownBy(() -> new ZScoreDetectionEngine(settings))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("deviationFactor");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AnomalyResult single(MetricSeries s) {
        List<AnomalyResult> results = engine.detect(s);
        assertThat(results).hasSize(1);
        return results.get(0);
    }
}
