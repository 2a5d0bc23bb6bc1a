package com.fleetrank.core.window;

import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.error.InsufficientDataException;
import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-count window extractor.
 *
 * <p>
 * Windows start at offsets {@code 0, stride, 2·stride, …} and span exactly
 * {@code windowSizePoints} samples. A trailing partial window is dropped,
 * never padded, so the number of windows for a series of {@code n} samples
 * is {@code floor((n - size) / stride) + 1}.
 * </p>
 *
 * @since 1.0.0
 */
public class PointWindowExtractor implements WindowExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(PointWindowExtractor.class);

    private final int windowSizePoints;
    private final int stridePoints;

    /**
     * @param windowSizePoints samples per window; must be {@code > 0}
     * @param stridePoints     samples between window starts; must be {@code > 0}
     * @throws ConfigException if either value is not positive
     */
    public PointWindowExtractor(int windowSizePoints, int stridePoints) {
        if (windowSizePoints <= 0) {
            throw new ConfigException("windowSizePoints must be > 0, got: " + windowSizePoints);
        }
        if (stridePoints <= 0) {
            throw new ConfigException("stridePoints must be > 0, got: " + stridePoints);
        }
        this.windowSizePoints = windowSizePoints;
        this.stridePoints = stridePoints;
    }

    /**
     * Non-overlapping windows: the stride equals the window size.
     *
     * @param windowSizePoints samples per window
     * @return the extractor
     */
    public static PointWindowExtractor tumbling(int windowSizePoints) {
        return new PointWindowExtractor(windowSizePoints, windowSizePoints);
    }

    /**
     * @throws InsufficientDataException if the series has fewer samples than
     *                                   one window
     */
    @Override
    public List<TimeWindow> extract(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int length = series.size();
        if (length < windowSizePoints) {
            throw new InsufficientDataException(length, windowSizePoints);
        }

        List<TimeWindow> windows = new ArrayList<>(expectedWindowCount(length));
        int lastStart = length - windowSizePoints;
        int windowNumber = 1;
        int start = 0;
        while (true) {
            int end = start + windowSizePoints;
            windows.add(new TimeWindow(start, end,
                    series.getTimestamp(start), series.getTimestamp(end - 1), windowNumber++));
            // compare against the remaining room so start never overflows
            if (stridePoints > lastStart - start) {
                break;
            }
            start += stridePoints;
        }

        LOG.debug("Extracted {} point window(s) from {} ({} samples)", windows.size(),
                series.getSeriesKey(), length);
        return Collections.unmodifiableList(windows);
    }

    /**
     * Number of windows a series of {@code length} samples yields.
     *
     * @param length series length
     * @return {@code max(0, floor((length - size) / stride) + 1)}
     */
    public int expectedWindowCount(int length) {
        if (length < windowSizePoints) {
            return 0;
        }
        return (length - windowSizePoints) / stridePoints + 1;
    }

    public int getWindowSizePoints() {
        return windowSizePoints;
    }

    public int getStridePoints() {
        return stridePoints;
    }

    public boolean isOverlapping() {
        return stridePoints < windowSizePoints;
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("mode", "points");
        settings.put("windowSizePoints", windowSizePoints);
        settings.put("stridePoints", stridePoints);
        settings.put("overlapping", isOverlapping());
        return settings;
    }

    @Override
    public String toString() {
        return "PointWindowExtractor" + describe();
    }
}
