package com.driftmonitor.monitor;

import com.driftmonitor.exception.EmptyReportException;
import com.driftmonitor.exception.EmptySampleException;
import com.driftmonitor.exception.InvalidConfigException;
import com.driftmonitor.exception.InvalidSampleException;
import com.driftmonitor.exception.SchemaMismatchException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class DriftMonitorTest {

    private final DriftMonitor monitor = new DriftMonitor(new KolmogorovSmirnovComparator());

    private static double[] normalQuantiles(int n, double offset) {
        NormalDistribution normal = new NormalDistribution(0.0, 1.0);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = normal.inverseCumulativeProbability((i + offset) / n);
        }
        return values;
    }

    private static double[] gaussian(long seed, int n) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = random.nextGaussian();
        }
        return values;
    }

    private static Map<String, FeatureSample> reference(Map<String, double[]> raw) {
        Map<String, FeatureSample> samples = new LinkedHashMap<>();
        raw.forEach((name, values) -> samples.put(name, FeatureSample.reference(name, values)));
        return samples;
    }

    private static Map<String, FeatureSample> current(Map<String, double[]> raw) {
        Map<String, FeatureSample> samples = new LinkedHashMap<>();
        raw.forEach((name, values) -> samples.put(name, FeatureSample.current(name, values)));
        return samples;
    }

    @Test
    void evaluate_reportHasOneResultPerInputFeature() {
        Map<String, double[]> ref = Map.of(
            "price", normalQuantiles(200, 0.5),
            "discount", normalQuantiles(200, 0.5),
            "stock", new double[] {1, 2, 3});
        Map<String, double[]> cur = Map.of(
            "price", normalQuantiles(150, 0.25),
            "discount", gaussian(3, 150),
            "stock", new double[] {1, 2, 3});

        DriftReport report = monitor.evaluate(reference(ref), current(cur));

        assertThat(report.getResults()).hasSize(3);
        assertThat(report.getFeatureCount()).isEqualTo(ref.size()).isEqualTo(cur.size());
        assertThat(report.getResults()).extracting(DriftResult::getFeature)
            .containsExactly("discount", "price", "stock");
    }

    @Test
    void evaluate_sameDistribution_doesNotRecommendRetraining() {
        DriftReport report = monitor.evaluate(
            reference(Map.of("a", normalQuantiles(1000, 0.5), "b", normalQuantiles(500, 0.5))),
            current(Map.of("a", normalQuantiles(1000, 0.25), "b", normalQuantiles(800, 0.75))));

        assertThat(report.isRetrainRecommended()).isFalse();
        assertThat(report.getSignificantCount()).isZero();
        assertThat(report.getMaxStatistic()).isZero();
        assertThat(report.getDriftedFeatures()).isEmpty();
        assertThat(report.getResults()).allSatisfy(r -> {
            assertThat(r.getVerdict()).isEqualTo(DriftVerdict.NOT_SIGNIFICANT);
            assertThat(r.getPValue()).isGreaterThan(0.9);
        });
    }

    @Test
    void evaluate_seededSamplesFromSameDistribution_doNotRecommendRetraining() {
        DriftMonitorConfig strict = DriftMonitorConfig.builder().significanceLevel(0.001).build();

        DriftReport report = monitor.evaluate(
            reference(Map.of("latency", gaussian(11L, 1000))),
            current(Map.of("latency", gaussian(12L, 1000))),
            strict);

        assertThat(report.isRetrainRecommended()).isFalse();
    }

    @Test
    void evaluate_constantFarOutsideReference_isSignificantAndRecommendsRetraining() {
        double[] shifted = new double[1000];
        Arrays.fill(shifted, 50.0);

        DriftReport report = monitor.evaluate(
            reference(Map.of("price", gaussian(7L, 1000), "discount", normalQuantiles(1000, 0.5))),
            current(Map.of("price", shifted, "discount", normalQuantiles(1000, 0.25))));

        DriftResult price = report.getResults().stream()
            .filter(r -> r.getFeature().equals("price")).findFirst().orElseThrow();
        assertThat(price.isSignificant()).isTrue();
        assertThat(price.getStatistic()).isEqualTo(1.0);
        assertThat(price.getPValue()).isLessThan(0.05);
        assertThat(report.isRetrainRecommended()).isTrue();
        assertThat(report.getMaxStatistic()).isEqualTo(1.0);
        assertThat(report.getDriftedFeatures()).containsExactly("price");
    }

    @Test
    void evaluate_mismatchedFeatureSets_throwsSchemaMismatchNamingBothSides() {
        double[] values = normalQuantiles(50, 0.5);

        assertThatThrownBy(() -> monitor.evaluate(
                reference(Map.of("a", values, "b", values)),
                current(Map.of("a", values, "c", values))))
            .isInstanceOfSatisfying(SchemaMismatchException.class, ex -> {
                assertThat(ex.getMissingFromCurrent()).containsExactly("b");
                assertThat(ex.getMissingFromReference()).containsExactly("c");
                assertThat(ex.getCode()).isEqualTo("SCHEMA_MISMATCH");
            })
            .hasMessageContaining("b")
            .hasMessageContaining("c");
    }

    @Test
    void evaluate_extraProductionColumn_isNotIgnored() {
        double[] values = normalQuantiles(50, 0.5);

        assertThatThrownBy(() -> monitor.evaluate(
                reference(Map.of("a", values)),
                current(Map.of("a", values, "new_column", values))))
            .isInstanceOfSatisfying(SchemaMismatchException.class, ex -> {
                assertThat(ex.getMissingFromReference()).containsExactly("new_column");
                assertThat(ex.getMissingFromCurrent()).isEmpty();
            });
    }

    @Test
    void evaluate_sampleBelowMinimum_isInconclusive() {
        DriftReport report = monitor.evaluate(
            reference(Map.of("tiny", new double[] {1, 2, 3, 4, 5}, "ok", normalQuantiles(100, 0.5))),
            current(Map.of("tiny", new double[] {100, 200, 300, 400, 500}, "ok", normalQuantiles(100, 0.25))));

        DriftResult tiny = report.getResults().get(1);
        assertThat(tiny.getFeature()).isEqualTo("tiny");
        assertThat(tiny.getVerdict()).isEqualTo(DriftVerdict.INCONCLUSIVE);
        assertThat(tiny.isSignificant()).isFalse();
        assertThat(tiny.getStatistic()).isNull();
        assertThat(tiny.getPValue()).isNull();
        assertThat(tiny.getNote()).contains("30 required");
        assertThat(report.getInconclusiveCount()).isEqualTo(1);
        assertThat(report.isRetrainRecommended()).isFalse();
    }

    @Test
    void evaluate_onlyOneSideUndersized_isStillInconclusive() {
        DriftReport report = monitor.evaluate(
            reference(Map.of("x", normalQuantiles(500, 0.5))),
            current(Map.of("x", new double[] {9, 9, 9})));

        assertThat(report.getResults().get(0).getVerdict()).isEqualTo(DriftVerdict.INCONCLUSIVE);
        assertThat(report.getResults().get(0).getReferenceSize()).isEqualTo(500);
        assertThat(report.getResults().get(0).getCurrentSize()).isEqualTo(3);
    }

    @Test
    void evaluate_failOnInsufficientSample_throwsEmptySample() {
        DriftMonitorConfig config = DriftMonitorConfig.builder().failOnInsufficientSample(true).build();

        assertThatThrownBy(() -> monitor.evaluate(
                reference(Map.of("tiny", new double[] {1, 2, 3, 4, 5}, "ok", normalQuantiles(100, 0.5))),
                current(Map.of("tiny", new double[] {1, 2, 3, 4, 5}, "ok", normalQuantiles(100, 0.5))),
                config))
            .isInstanceOfSatisfying(EmptySampleException.class,
                ex -> assertThat(ex.getFeatures()).containsExactly("tiny"));
    }

    @Test
    void evaluate_minSampleSizeOfOne_stillNeedsTwoObservationsForTheTest() {
        DriftMonitorConfig config = DriftMonitorConfig.builder().minSampleSize(1).build();

        DriftReport report = monitor.evaluate(
            reference(Map.of("x", new double[] {1.0})),
            current(Map.of("x", new double[] {2.0})),
            config);

        assertThat(report.getResults().get(0).getVerdict()).isEqualTo(DriftVerdict.INCONCLUSIVE);
    }

    @Test
    void evaluate_isDeterministic() {
        // small integer samples with ties take the exact p-value path with tie-breaking jitter
        double[] ref = new double[40];
        double[] cur = new double[40];
        for (int i = 0; i < 40; i++) {
            ref[i] = i % 7;
            cur[i] = (i % 5) + 1;
        }
        Map<String, FeatureSample> reference = reference(Map.of("ties", ref, "gauss", gaussian(1L, 300)));
        Map<String, FeatureSample> current = current(Map.of("ties", cur, "gauss", gaussian(2L, 300)));

        DriftReport first = monitor.evaluate(reference, current);
        DriftReport second = monitor.evaluate(reference, current);

        assertThat(second).isEqualTo(first);
        for (int i = 0; i < first.getResults().size(); i++) {
            assertThat(Double.doubleToLongBits(second.getResults().get(i).getPValue()))
                .isEqualTo(Double.doubleToLongBits(first.getResults().get(i).getPValue()));
        }
    }

    @Test
    void evaluate_emptyInput_failsInsteadOfReportingNoDrift() {
        assertThatThrownBy(() -> monitor.evaluate(new HashMap<>(), new HashMap<>()))
            .isInstanceOf(EmptyReportException.class);
    }

    @Test
    void evaluate_invalidConfig_failsBeforeTouchingSamples() {
        DriftMonitorConfig bad = DriftMonitorConfig.builder().significanceLevel(1.5).build();

        assertThatThrownBy(() -> monitor.evaluate(
                reference(Map.of("a", new double[] {1, 2})),
                current(Map.of("b", new double[] {1, 2})),
                bad))
            .isInstanceOf(InvalidConfigException.class)
            .hasMessageContaining("significanceLevel");
    }

    @Test
    void evaluate_sampleTaggedWithWrongSide_isRejected() {
        double[] values = normalQuantiles(50, 0.5);
        Map<String, FeatureSample> ref = Map.of("a", FeatureSample.current("a", values));

        assertThatThrownBy(() -> monitor.evaluate(ref, current(Map.of("a", values))))
            .isInstanceOf(InvalidSampleException.class)
            .hasMessageContaining("tagged CURRENT");
    }
}
