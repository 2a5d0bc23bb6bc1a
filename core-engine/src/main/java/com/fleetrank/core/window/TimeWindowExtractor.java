package com.fleetrank.core.window;

import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wall-clock window extractor.
 *
 * <p>
 * Windows are anchored at the first timestamp of the series and then every
 * {@code strideDuration}, for as long as the anchor does not pass the last
 * timestamp. Each window covers the samples in
 * {@code [anchor, anchor + windowDuration)}.
 * </p>
 *
 * <p>
 * The anchor bound is inclusive: an anchor equal to the last timestamp still
 * opens a window, so a single-sample series yields one window holding that
 * sample rather than none. A window end that would pass {@link Instant#MAX}
 * is capped there, so any positive duration is usable.
 * </p>
 *
 * <p>
 * A sparse series can produce windows with few or no samples. Empty
 * windows are returned like any other (see {@link TimeWindow#isEmpty()});
 * consumers decide how to account for them.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeWindowExtractor implements WindowExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(TimeWindowExtractor.class);

    private final Duration windowDuration;
    private final Duration strideDuration;

    /**
     * @param windowDuration length of each window; must be positive
     * @param strideDuration distance between anchors; must be positive
     * @throws ConfigException if either duration is missing, zero or negative
     */
    public TimeWindowExtractor(Duration windowDuration, Duration strideDuration) {
        if (windowDuration == null || windowDuration.isZero() || windowDuration.isNegative()) {
            throw new ConfigException("windowDuration must be positive, got: " + windowDuration);
        }
        if (strideDuration == null || strideDuration.isZero() || strideDuration.isNegative()) {
            throw new ConfigException("strideDuration must be positive, got: " + strideDuration);
        }
        this.windowDuration = windowDuration;
        this.strideDuration = strideDuration;
    }

    public static TimeWindowExtractor tumbling(Duration windowDuration) {
        return new TimeWindowExtractor(windowDuration, windowDuration);
    }

    @Override
    public List<TimeWindow> extract(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        Instant last = series.getEndTime();

        List<TimeWindow> windows = new ArrayList<>();
        int windowNumber = 1;
        int empty = 0;
        Instant anchor = series.getStartTime();
        while (true) {
            Instant end = plusCapped(anchor, windowDuration);
            int startIndex = firstIndexAtOrAfter(series, anchor);
            int endIndex = firstIndexAtOrAfter(series, end);
            TimeWindow window = new TimeWindow(startIndex, endIndex, anchor, end, windowNumber++);
            if (window.isEmpty()) {
                empty++;
            }
            windows.add(window);
            if (strideDuration.compareTo(Duration.between(anchor, last)) > 0) {
                break;
            }
            anchor = anchor.plus(strideDuration);
        }

        LOG.debug("Extracted {} time window(s) ({} empty) from {}", windows.size(), empty,
                series.getSeriesKey());
        return Collections.unmodifiableList(windows);
    }

    /**
     * {@code instant + duration}, or {@link Instant#MAX} when the sum is not
     * representable.
     */
    static Instant plusCapped(Instant instant, Duration duration) {
        if (duration.compareTo(Duration.between(instant, Instant.MAX)) > 0) {
            return Instant.MAX;
        }
        return instant.plus(duration);
    }

    /**
     * Binary search for the first sample whose timestamp is not before
     * {@code target}; returns the series size when there is none.
     */
    static int firstIndexAtOrAfter(MetricSeries series, Instant target) {
        int low = 0;
        int high = series.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (series.getTimestamp(mid).isBefore(target)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    public Duration getWindowDuration() {
        return windowDuration;
    }

    public Duration getStrideDuration() {
        return strideDuration;
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("mode", "time");
        settings.put("windowDuration", windowDuration.toString());
        settings.put("strideDuration", strideDuration.toString());
        settings.put("overlapping", strideDuration.compareTo(windowDuration) < 0);
        return settings;
    }

    @Override
    public String toString() {
        return "TimeWindowExtractor" + describe();
    }
}
