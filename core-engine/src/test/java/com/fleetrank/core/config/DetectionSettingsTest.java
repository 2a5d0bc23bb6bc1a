package com.fleetrank.core.config;

import com.fleetrank.core.error.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionSettings}.
 */
class DetectionSettingsTest {

    @Test
    @DisplayName("Should accept the defaults")
    void shouldAcceptDefaults() {
        DetectionSettings settings = new DetectionSettings();

        assertThatCode(settings::validate).doesNotThrowAnyException();
        assertThat(settings.getEngine()).isEqualTo("zscore");
    }

    @Test
    @DisplayName("Should normalise the engine name")
    void shouldNormaliseEngineName() {
        DetectionSettings settings = new DetectionSettings();
        settings.setEngine("  Threshold ");

        assertThat(settings.getEngine()).isEqualTo("threshold");
    }

    @Test
    @DisplayName("Should require a threshold for the threshold engine")
    void shouldRequireThreshold() {
        DetectionSettings settings = new DetectionSettings();
        settings.setEngine("threshold");

        assertThatThrownBy(settings::validate)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("finite 'threshold'");
    }

    @Test
    @DisplayName("Should report every zscore problem at once")
    void shouldCollectZScoreErrors() {
        DetectionSettings settings = new DetectionSettings();
        settings.setDeviationFactor(-1);
        settings.setMinSamples(1);

        assertThatThrownBy(settings::validate)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("deviationFactor")
                .hasMessageContaining("minSamples");
    }

    @Test
    @DisplayName("Should leave unknown engine names to the registry")
    void shouldAcceptCustomEngineNames() {
        DetectionSettings settings = new DetectionSettings();
        settings.setEngine("isolation-forest");

        assertThatCode(settings::validate).doesNotThrowAnyException();
    }
}
