package com.fleetrank.core.pipeline;

import com.fleetrank.core.model.EntityKey;

import java.util.Objects;

/**
 * What one node partition produced during a scoring run.
 *
 * <p>
 * {@code numInputs} counts the anomaly results that fed the node score. It is
 * zero when every window was empty or every series was too short, in which
 * case the node has no score in the run's output.
 * </p>
 *
 * @since 1.0.0
 */
public final class PartitionReport {

    private final EntityKey key;
    private final int seriesCount;
    private final int windowCount;
    private final int emptyWindowCount;
    private final int numInputs;

    public PartitionReport(EntityKey key, int seriesCount, int windowCount, int emptyWindowCount, int numInputs) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.seriesCount = seriesCount;
        this.windowCount = windowCount;
        this.emptyWindowCount = emptyWindowCount;
        this.numInputs = numInputs;
    }

    public EntityKey getKey() {
        return key;
    }

    public int getSeriesCount() {
        return seriesCount;
    }

    public int getWindowCount() {
        return windowCount;
    }

    public int getEmptyWindowCount() {
        return emptyWindowCount;
    }

    public int getNumInputs() {
        return numInputs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PartitionReport that))
            return false;
        return seriesCount == that.seriesCount
                && windowCount == that.windowCount
                && emptyWindowCount == that.emptyWindowCount
                && numInputs == that.numInputs
                && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, seriesCount, windowCount, emptyWindowCount, numInputs);
    }

    @Override
    public String toString() {
        return "PartitionReport{" +
                "key=" + key +
                ", series=" + seriesCount +
                ", windows=" + windowCount +
                ", emptyWindows=" + emptyWindowCount +
                ", inputs=" + numInputs +
                '}';
    }
}
