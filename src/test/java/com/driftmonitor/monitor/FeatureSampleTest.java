package com.driftmonitor.monitor;

import com.driftmonitor.exception.InvalidSampleException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FeatureSampleTest {

    @Test
    void of_copiesValuesInAndOut() {
        double[] raw = {1.0, 2.0, 3.0};
        FeatureSample sample = FeatureSample.reference("price", raw);

        raw[0] = 99.0;
        sample.values()[1] = 99.0;

        assertThat(sample.values()).containsExactly(1.0, 2.0, 3.0);
        assertThat(sample.size()).isEqualTo(3);
        assertThat(sample.getSource()).isEqualTo(SampleSource.REFERENCE);
    }

    @Test
    void of_collection_convertsNumbers() {
        FeatureSample sample = FeatureSample.of("units", SampleSource.CURRENT, List.of(1, 2.5, 3L));

        assertThat(sample.values()).containsExactly(1.0, 2.5, 3.0);
    }

    @Test
    void of_rejectsNonFiniteObservations() {
        assertThatThrownBy(() -> FeatureSample.current("price", 1.0, Double.NaN))
            .isInstanceOf(InvalidSampleException.class)
            .hasMessageContaining("index 1");
        assertThatThrownBy(() -> FeatureSample.current("price", Double.POSITIVE_INFINITY))
            .isInstanceOf(InvalidSampleException.class);
    }

    @Test
    void of_rejectsNullObservationAndBlankName() {
        assertThatThrownBy(() -> FeatureSample.of("price", SampleSource.CURRENT, Arrays.asList(1.0, null)))
            .isInstanceOf(InvalidSampleException.class)
            .hasMessageContaining("null observation");
        assertThatThrownBy(() -> FeatureSample.reference(" ", 1.0))
            .isInstanceOf(InvalidSampleException.class);
    }

    @Test
    void emptySample_isAllowedAndLeftToTheMonitor() {
        assertThat(FeatureSample.current("price").size()).isZero();
    }

    @Test
    void equality_usesValues() {
        assertThat(FeatureSample.reference("a", 1.0, 2.0)).isEqualTo(FeatureSample.reference("a", 1.0, 2.0));
        assertThat(FeatureSample.reference("a", 1.0, 2.0)).isNotEqualTo(FeatureSample.current("a", 1.0, 2.0));
    }
}
