package com.driftmonitor.monitor;

import com.driftmonitor.exception.EmptyReportException;
import lombok.Value;

import java.util.List;

/**
 * Everything one monitoring run decided. A report is built once, from the complete list of
 * per-feature results, and never changes afterwards.
 *
 * <p>{@code maxStatistic} only looks at significant features: a large but insignificant
 * statistic is sampling noise and must not move the decision. With no significant feature
 * it is {@code 0.0}. {@code retrainRecommended} holds exactly when some significant feature
 * has a statistic strictly above the drift magnitude threshold.
 */
@Value
public class DriftReport {

    List<DriftResult> results;
    double maxStatistic;
    boolean retrainRecommended;
    int significantCount;
    int inconclusiveCount;
    List<String> driftedFeatures;
    double significanceLevel;
    double driftMagnitudeThreshold;

    private DriftReport(List<DriftResult> results, double significanceLevel, double driftMagnitudeThreshold) {
        if (results == null || results.isEmpty()) {
            throw new EmptyReportException();
        }
        this.results = List.copyOf(results);
        this.significanceLevel = significanceLevel;
        this.driftMagnitudeThreshold = driftMagnitudeThreshold;

        List<DriftResult> significant = this.results.stream()
            .filter(DriftResult::isSignificant)
            .toList();
        this.significantCount = significant.size();
        this.inconclusiveCount = (int) this.results.stream().filter(DriftResult::isInconclusive).count();
        this.maxStatistic = significant.stream()
            .mapToDouble(DriftResult::getStatistic)
            .max()
            .orElse(0.0);
        this.driftedFeatures = significant.stream()
            .filter(r -> r.getStatistic() > driftMagnitudeThreshold)
            .map(DriftResult::getFeature)
            .toList();
        this.retrainRecommended = !driftedFeatures.isEmpty();
    }

    public static DriftReport of(List<DriftResult> results, DriftMonitorConfig config) {
        return new DriftReport(results, config.getSignificanceLevel(), config.getDriftMagnitudeThreshold());
    }

    public int getFeatureCount() {
        return results.size();
    }
}
