package com.driftmonitor.monitor;

import com.driftmonitor.exception.InvalidSampleException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Observations of one feature taken from one side of a run. The values are copied on the
 * way in and on the way out, so a sample never changes after it is collected.
 */
public final class FeatureSample {

    private final String feature;
    private final SampleSource source;
    private final double[] values;

    private FeatureSample(String feature, SampleSource source, double[] values) {
        if (feature == null || feature.isBlank()) {
            throw new InvalidSampleException("Feature name must not be blank");
        }
        if (source == null) {
            throw new InvalidSampleException("Sample for feature '" + feature + "' has no source label");
        }
        if (values == null) {
            throw new InvalidSampleException("Sample for feature '" + feature + "' has no observations array");
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new InvalidSampleException("Sample for feature '" + feature + "' (" + source
                    + ") has a non-finite observation at index " + i + ": " + values[i]);
            }
        }
        this.feature = feature;
        this.source = source;
        this.values = values;
    }

    public static FeatureSample of(String feature, SampleSource source, double... values) {
        return new FeatureSample(feature, source, values == null ? null : values.clone());
    }

    public static FeatureSample of(String feature, SampleSource source, Collection<? extends Number> values) {
        if (values == null) {
            return new FeatureSample(feature, source, null);
        }
        double[] copy = new double[values.size()];
        int i = 0;
        for (Number value : values) {
            if (value == null) {
                throw new InvalidSampleException("Sample for feature '" + feature + "' (" + source
                    + ") has a null observation at index " + i);
            }
            copy[i++] = value.doubleValue();
        }
        return new FeatureSample(feature, source, copy);
    }

    public static FeatureSample reference(String feature, double... values) {
        return of(feature, SampleSource.REFERENCE, values);
    }

    public static FeatureSample current(String feature, double... values) {
        return of(feature, SampleSource.CURRENT, values);
    }

    public String getFeature() {
        return feature;
    }

    public SampleSource getSource() {
        return source;
    }

    public int size() {
        return values.length;
    }

    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureSample other)) {
            return false;
        }
        return feature.equals(other.feature) && source == other.source && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(feature, source) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureSample[" + feature + ", " + source + ", n=" + values.length + "]";
    }
}
