package com.driftmonitor.monitor;

/**
 * Two-sample test of whether two independent samples come from the same distribution.
 * Implementations must be deterministic and safe to call from concurrent runs.
 */
public interface DistributionComparator {

    Comparison compare(double[] reference, double[] current);

    /** Smallest sample size, per side, the test can be computed on at all. */
    default int minimumObservations() {
        return 1;
    }

    String name();

    /**
     * @param statistic distance between the two samples, in [0, 1]
     * @param pValue    probability of a distance at least this large under the null hypothesis, in [0, 1]
     */
    record Comparison(double statistic, double pValue) {
        public Comparison {
            statistic = clamp(statistic);
            pValue = clamp(pValue);
        }

        private static double clamp(double value) {
            return Math.max(0.0, Math.min(1.0, value));
        }
    }
}
