package com.driftmonitor.monitor;

import com.driftmonitor.exception.InvalidConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Thresholds a run is decided with. All fields default to the values the monitor ships with.
 */
@Value
@Builder(toBuilder = true)
public class DriftMonitorConfig {

    public static final double DEFAULT_SIGNIFICANCE_LEVEL = 0.05;
    public static final double DEFAULT_DRIFT_MAGNITUDE_THRESHOLD = 0.05;
    public static final int DEFAULT_MIN_SAMPLE_SIZE = 30;

    /** A feature is significant when its p-value is strictly below this level. */
    @Builder.Default
    double significanceLevel = DEFAULT_SIGNIFICANCE_LEVEL;

    /** A significant feature recommends retraining only when its statistic is strictly above this. */
    @Builder.Default
    double driftMagnitudeThreshold = DEFAULT_DRIFT_MAGNITUDE_THRESHOLD;

    @Builder.Default
    int minSampleSize = DEFAULT_MIN_SAMPLE_SIZE;

    /** When set, under-sized features fail the run instead of being reported as inconclusive. */
    @Builder.Default
    boolean failOnInsufficientSample = false;

    public static DriftMonitorConfig defaults() {
        return DriftMonitorConfig.builder().build();
    }

    public DriftMonitorConfig validate() {
        requireUnitInterval("significanceLevel", significanceLevel);
        requireUnitInterval("driftMagnitudeThreshold", driftMagnitudeThreshold);
        if (minSampleSize <= 0) {
            throw new InvalidConfigException("minSampleSize must be positive, was " + minSampleSize);
        }
        return this;
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigException(name + " must be within [0, 1], was " + value);
        }
    }
}
