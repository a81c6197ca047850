package com.driftmonitor.monitor;

import com.driftmonitor.exception.EmptyReportException;
import com.driftmonitor.exception.EmptySampleException;
import com.driftmonitor.exception.InvalidSampleException;
import com.driftmonitor.exception.SchemaMismatchException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides, from a reference and a current sample per feature, whether a model has drifted
 * far enough to be retrained.
 *
 * <p>{@link #evaluate} is a pure function: it performs no I/O, keeps no state between calls
 * and never triggers retraining itself. Concurrent calls share nothing mutable.
 */
@Component
@RequiredArgsConstructor
public class DriftMonitor {

    private final DistributionComparator comparator;

    public DriftReport evaluate(Map<String, FeatureSample> reference,
                                Map<String, FeatureSample> current,
                                DriftMonitorConfig config) {
        config.validate();
        if (reference == null || current == null || (reference.isEmpty() && current.isEmpty())) {
            throw new EmptyReportException();
        }
        requireSameFeatures(reference.keySet(), current.keySet());

        int required = Math.max(config.getMinSampleSize(), comparator.minimumObservations());
        List<DriftResult> results = new ArrayList<>(reference.size());
        List<String> undersized = new ArrayList<>();

        for (String feature : new TreeSet<>(reference.keySet())) {
            FeatureSample ref = requireSource(feature, reference.get(feature), SampleSource.REFERENCE);
            FeatureSample cur = requireSource(feature, current.get(feature), SampleSource.CURRENT);

            if (ref.size() < required || cur.size() < required) {
                undersized.add(feature);
                results.add(DriftResult.inconclusive(feature, ref.size(), cur.size(), required));
                continue;
            }
            DistributionComparator.Comparison comparison = comparator.compare(ref.values(), cur.values());
            results.add(DriftResult.tested(feature, comparison, ref.size(), cur.size(),
                config.getSignificanceLevel()));
        }

        if (config.isFailOnInsufficientSample() && !undersized.isEmpty()) {
            throw new EmptySampleException(undersized, required);
        }
        return DriftReport.of(results, config);
    }

    public DriftReport evaluate(Map<String, FeatureSample> reference, Map<String, FeatureSample> current) {
        return evaluate(reference, current, DriftMonitorConfig.defaults());
    }

    private static void requireSameFeatures(Set<String> reference, Set<String> current) {
        Set<String> missingFromCurrent = new TreeSet<>(reference);
        missingFromCurrent.removeAll(current);
        Set<String> missingFromReference = new TreeSet<>(current);
        missingFromReference.removeAll(reference);
        if (!missingFromCurrent.isEmpty() || !missingFromReference.isEmpty()) {
            throw new SchemaMismatchException(missingFromReference, missingFromCurrent);
        }
    }

    private static FeatureSample requireSource(String feature, FeatureSample sample, SampleSource expected) {
        if (sample == null) {
            throw new InvalidSampleException("No " + expected + " sample supplied for feature '" + feature + "'");
        }
        if (sample.getSource() != expected) {
            throw new InvalidSampleException("Feature '" + feature + "' was supplied as " + expected
                + " but its sample is tagged " + sample.getSource());
        }
        return sample;
    }
}
