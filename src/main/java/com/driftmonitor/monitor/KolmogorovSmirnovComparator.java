package com.driftmonitor.monitor;

import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.springframework.stereotype.Component;

/**
 * Two-sample Kolmogorov-Smirnov test. The statistic is the largest gap between the two
 * empirical CDFs. Small samples (n * m below 10 000) get an exact p-value, larger ones the
 * asymptotic approximation. Commons Math breaks ties in small samples with a fixed-seed jitter,
 * so repeated calls on the same data return the same numbers.
 * <p>
 * When a small pair of samples has ties, the p-value is computed on the jittered copies while
 * the statistic comes from the raw data, so the two can disagree slightly near a threshold.
 */
@Component
public class KolmogorovSmirnovComparator implements DistributionComparator {

    @Override
    public Comparison compare(double[] reference, double[] current) {
        // KolmogorovSmirnovTest keeps a RandomGenerator, so one instance per call
        KolmogorovSmirnovTest test = new KolmogorovSmirnovTest();
        double statistic = test.kolmogorovSmirnovStatistic(reference, current);
        double pValue = test.kolmogorovSmirnovTest(reference, current);
        return new Comparison(statistic, pValue);
    }

    @Override
    public int minimumObservations() {
        return 2;
    }

    @Override
    public String name() {
        return "kolmogorov_smirnov_two_sample";
    }
}
