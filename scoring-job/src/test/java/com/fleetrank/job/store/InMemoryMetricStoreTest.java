package com.fleetrank.job.store;

import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryMetricStore}.
 */
class InMemoryMetricStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryMetricStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetricStore();
        store.store(series("n2", "cpu", 10));
        store.store(series("n1", "cpu", 10));
    }

    @Test
    @DisplayName("Should return stored keys in sorted order")
    void shouldReturnSortedKeys() {
        assertThat(store.keys()).extracting(SeriesKey::getNodeId).containsExactly("n1", "n2");
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should filter samples to an inclusive time range")
    void shouldFilterInclusively() {
        MetricSeries result = store.getMetricSeries("t1", "c1", "n1", "cpu",
                T0.plus(minutes(2)), T0.plus(minutes(5)));

        assertThat(result.size()).isEqualTo(4);
        assertThat(result.getStartTime()).isEqualTo(T0.plus(minutes(2)));
        assertThat(result.getEndTime()).isEqualTo(T0.plus(minutes(5)));
        assertThat(result.getMetadata()).containsEntry("source", "test");
    }

    @Test
    @DisplayName("Should replace a series stored under the same key")
    void shouldReplaceExisting() {
        store.store(series("n1", "cpu", 3));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.getMetricSeries("t1", "c1", "n1", "cpu", T0, T0.plus(Duration.ofDays(1))).size())
                .isEqualTo(3);
    }

    @Test
    @DisplayName("Should throw for an unknown series")
    void shouldThrowForUnknownKey() {
        assertThatThrownBy(() -> store.getMetricSeries("t1", "c1", "n9", "cpu", T0, T0.plus(minutes(10))))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("No data found");
    }

    @Test
    @DisplayName("Should throw when no sample falls in the range")
    void shouldThrowForEmptyRange() {
        assertThatThrownBy(() -> store.getMetricSeries("t1", "c1", "n1", "cpu",
                T0.plus(Duration.ofHours(1)), T0.plus(Duration.ofHours(2))))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("No data in time range");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSeries series(String node, String metric, int points) {
        MetricSeries.Builder builder = MetricSeries.builder()
                .tenantId("t1").clusterId("c1").nodeId(node).metricName(metric)
                .metadata("source", "test");
        for (int i = 0; i < points; i++) {
            builder.sample(T0.plus(minutes(i)), i);
        }
        return builder.build();
    }

    private static Duration minutes(long n) {
        return Duration.ofMinutes(n);
    }
}
